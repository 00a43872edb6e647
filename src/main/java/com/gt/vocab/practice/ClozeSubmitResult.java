package com.gt.vocab.practice;

public record ClozeSubmitResult(boolean correct, boolean nearCorrect, String expected) { }
