package com.example.intent.model;

public record ChainOfThoughtStep(int stepNumber, String thought, String conclusion, boolean revised) {

    public ChainOfThoughtStep revise(String correctedConclusion) {
        return new ChainOfThoughtStep(stepNumber, thought, correctedConclusion, true);
    }
}
