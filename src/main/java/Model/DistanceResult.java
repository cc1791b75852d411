package Model;

public record DistanceResult(boolean similar, double weightedDistance) {}
