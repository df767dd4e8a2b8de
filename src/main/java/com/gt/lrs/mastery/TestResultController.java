package com.gt.lrs.mastery;

import com.gt.lrs.model.SubmitTestResultsResponse;
import com.gt.lrs.model.TestResult;
import com.gt.lrs.model.UserMasteryHistory;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/rest/testResults")
public class TestResultController {

    private final TestResultService testResultService;

    public TestResultController(TestResultService testResultService) {
        this.testResultService = testResultService;
    }

    @PostMapping(value = "{script}/{skill}", consumes = "application/json", produces = "application/json")
    public SubmitTestResultsResponse submitResults(@PathVariable("script") String script,
                                                   @PathVariable("skill") String skill,
                                                   @RequestBody SubmitTestResultsRequest request,
                                                   @AuthenticationPrincipal Long userId) {
        return testResultService.submitResults(userId, script, skill, request.results(), request.repeat());
    }

    @GetMapping(value = "history", produces = "application/json")
    public List<UserMasteryHistory> getUserHistory(@AuthenticationPrincipal Long userId) {
        return testResultService.getUserHistory(userId);
    }

    private record SubmitTestResultsRequest(List<TestResult> results, String repeat) { }
}
