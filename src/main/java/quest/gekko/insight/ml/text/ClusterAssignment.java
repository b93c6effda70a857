package quest.gekko.insight.ml.text;

public record ClusterAssignment(String documentId, int clusterId, double distance) {
}
