package com.bko.biketracker.tracking.web;

import com.bko.biketracker.tracking.ActivityDetailUseCase;
import com.bko.biketracker.tracking.LoadDashboardUseCase;
import com.bko.biketracker.tracking.MergeActivitiesUseCase;
import com.bko.biketracker.tracking.UploadActivityUseCase;
import com.bko.biketracker.tracking.app.UploadReport;
import com.bko.biketracker.tracking.web.dto.ActivityDetailDto;
import com.bko.biketracker.tracking.web.dto.ProbeDto;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
public class ActivityApiController {
    private final ActivityDetailUseCase activityDetailUseCase;
    private final MergeActivitiesUseCase mergeActivitiesUseCase;
    private final UploadActivityUseCase uploadActivityUseCase;
    private final LoadDashboardUseCase loadDashboardUseCase;

    public ActivityApiController(ActivityDetailUseCase activityDetailUseCase,
                                 MergeActivitiesUseCase mergeActivitiesUseCase,
                                 UploadActivityUseCase uploadActivityUseCase,
                                 LoadDashboardUseCase loadDashboardUseCase) {
        this.activityDetailUseCase = activityDetailUseCase;
        this.mergeActivitiesUseCase = mergeActivitiesUseCase;
        this.uploadActivityUseCase = uploadActivityUseCase;
        this.loadDashboardUseCase = loadDashboardUseCase;
    }

    @GetMapping("/activities/{id}")
    public ActivityDetailDto activity(@PathVariable long id) {
        return ActivityDetailDto.from(activityDetailUseCase.loadActivity(id));
    }

    @PostMapping("/activities/{id}/merge")
    public ActivityDetailDto merge(@PathVariable long id, @RequestParam("into") long into) {
        return ActivityDetailDto.from(mergeActivitiesUseCase.merge(id, into));
    }

    @PostMapping("/activities/{id}/strava")
    public ResponseEntity<UploadReport> uploadToStrava(@PathVariable long id) {
        UploadReport report = uploadActivityUseCase.uploadToStrava(id);
        return ResponseEntity.status(report.isSuccess() ? HttpStatus.OK : HttpStatus.BAD_GATEWAY).body(report);
    }

    @GetMapping("/probes")
    public List<ProbeDto> probes(@RequestParam Instant from, @RequestParam Instant to) {
        return loadDashboardUseCase.probesReceivedBetween(from, to).stream()
                .map(ProbeDto::from)
                .toList();
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }
}
