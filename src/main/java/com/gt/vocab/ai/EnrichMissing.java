package com.gt.vocab.ai;

// Which parts of a card's learning content an enrichment call should generate
public record EnrichMissing(boolean needExamples, boolean needMnemonics, boolean needMeaningVariants, boolean needIpa) {

    public boolean any() {
        return needExamples || needMnemonics || needMeaningVariants || needIpa;
    }
}
