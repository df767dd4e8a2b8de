package com.gt.lrs.maintenance;

import com.gt.lrs.mastery.TestResultService;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

// Service-to-service endpoints. Access is limited to callers presenting the API key.
@RestController
@RequestMapping("/rest/maintenance")
public class MaintenanceController {

    private final TestResultService testResultService;

    public MaintenanceController(TestResultService testResultService) {
        this.testResultService = testResultService;
    }

    @PostMapping("dropMarks/{userId}")
    public void dropMarks(@PathVariable("userId") long userId) {
        testResultService.dropMarks(userId);
    }
}
