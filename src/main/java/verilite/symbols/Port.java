package verilite.symbols;

public record Port(int width, Direction direction) {
}
