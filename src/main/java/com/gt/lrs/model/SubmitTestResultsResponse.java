package com.gt.lrs.model;

public record SubmitTestResultsResponse(boolean askForRepeat) { }
