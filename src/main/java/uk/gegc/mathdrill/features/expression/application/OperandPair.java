package uk.gegc.mathdrill.features.expression.application;

public record OperandPair(int left, int right) {
}
