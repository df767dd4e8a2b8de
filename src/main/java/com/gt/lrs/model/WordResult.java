package com.gt.lrs.model;

// Boxed so that a missing period can be told apart from a period of 0
public record WordResult(Integer wordId, Integer period) { }
