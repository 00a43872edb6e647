package com.gt.vocab.sync;

public record SyncImportReport(int addedVocabs, int updatedVocabs, int addedLogs, int conflicts) { }
