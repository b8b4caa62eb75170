package uk.gegc.examgen.features.content.domain.model;

public enum AnswerInputType {
    MULTIPLE_CHOICE,
    TEXT_INPUT
}
