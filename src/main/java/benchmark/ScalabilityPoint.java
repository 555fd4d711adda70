package benchmark;

public record ScalabilityPoint(int textSize, double timeMs, int matches) {
}
