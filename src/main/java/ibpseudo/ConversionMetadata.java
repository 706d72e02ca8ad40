package ibpseudo;

public record ConversionMetadata(int originalLines, int convertedLines) {
}
