package com.bko.biketracker.tracking.web;

import com.bko.biketracker.shared.AppSettings;
import com.bko.biketracker.shared.ConfigStatus;
import com.bko.biketracker.tracking.ActivityDetailUseCase;
import com.bko.biketracker.tracking.ExportTrackUseCase;
import com.bko.biketracker.tracking.MergeActivitiesUseCase;
import com.bko.biketracker.tracking.UploadActivityUseCase;
import com.bko.biketracker.tracking.app.UploadReport;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.servlet.mvc.support.RedirectAttributes;

@Controller
public class ActivityController {
    private static final MediaType GPX = MediaType.parseMediaType("application/gpx+xml");

    private final ActivityDetailUseCase activityDetailUseCase;
    private final MergeActivitiesUseCase mergeActivitiesUseCase;
    private final ExportTrackUseCase exportTrackUseCase;
    private final UploadActivityUseCase uploadActivityUseCase;
    private final AppSettings settings;

    public ActivityController(ActivityDetailUseCase activityDetailUseCase,
                              MergeActivitiesUseCase mergeActivitiesUseCase,
                              ExportTrackUseCase exportTrackUseCase,
                              UploadActivityUseCase uploadActivityUseCase,
                              AppSettings settings) {
        this.activityDetailUseCase = activityDetailUseCase;
        this.mergeActivitiesUseCase = mergeActivitiesUseCase;
        this.exportTrackUseCase = exportTrackUseCase;
        this.uploadActivityUseCase = uploadActivityUseCase;
        this.settings = settings;
    }

    @GetMapping("/activities/{id}")
    public String activity(@PathVariable long id, Model model) {
        model.addAttribute("detail", activityDetailUseCase.loadActivity(id));
        model.addAttribute("config", ConfigStatus.from(settings));
        return "activity";
    }

    @PostMapping("/activities/{id}/merge")
    public String merge(@PathVariable long id, @RequestParam("into") long into) {
        mergeActivitiesUseCase.merge(id, into);
        return "redirect:/activities/" + into;
    }

    @GetMapping("/activities/{id}/gpx")
    public ResponseEntity<byte[]> exportGpx(@PathVariable long id) {
        byte[] gpx = exportTrackUseCase.exportGpx(id);
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"ride-" + id + ".gpx\"")
                .contentType(GPX)
                .body(gpx);
    }

    @PostMapping("/activities/{id}/strava")
    public String uploadToStrava(@PathVariable long id, RedirectAttributes redirectAttributes) {
        UploadReport report = uploadActivityUseCase.uploadToStrava(id);
        redirectAttributes.addFlashAttribute("report", report);
        return "redirect:/activities/" + id;
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<String> badRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest()
                .contentType(MediaType.TEXT_PLAIN)
                .body(e.getMessage());
    }
}
