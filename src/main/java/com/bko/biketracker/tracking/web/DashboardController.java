package com.bko.biketracker.tracking.web;

import com.bko.biketracker.shared.AppSettings;
import com.bko.biketracker.shared.ConfigStatus;
import com.bko.biketracker.tracking.LoadDashboardUseCase;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.GetMapping;

@Controller
public class DashboardController {
    private final LoadDashboardUseCase loadDashboardUseCase;
    private final AppSettings settings;

    public DashboardController(LoadDashboardUseCase loadDashboardUseCase, AppSettings settings) {
        this.loadDashboardUseCase = loadDashboardUseCase;
        this.settings = settings;
    }

    @GetMapping("/")
    public String index(Model model) {
        model.addAttribute("dashboard", loadDashboardUseCase.loadDashboard());
        model.addAttribute("config", ConfigStatus.from(settings));
        model.addAttribute("zone", settings.tracker().zoneId());
        return "index";
    }
}
