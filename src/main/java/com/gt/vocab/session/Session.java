package com.gt.vocab.session;

import com.gt.vocab.model.Vocab;

import java.util.List;

public record Session(List<Vocab> todayNew, List<Vocab> review) { }
