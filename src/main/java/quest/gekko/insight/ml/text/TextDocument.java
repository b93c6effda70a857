package quest.gekko.insight.ml.text;

public record TextDocument(String id, String text) {
}
