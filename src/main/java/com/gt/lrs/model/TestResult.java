package com.gt.lrs.model;

public record TestResult(Integer characterId, Boolean passed) { }
