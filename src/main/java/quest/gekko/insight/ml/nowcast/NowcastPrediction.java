package quest.gekko.insight.ml.nowcast;

public record NowcastPrediction(long predicted7d, long conservative, long optimistic) {

    public static NowcastPrediction flat(double current) {
        long value = Math.round(current);
        return new NowcastPrediction(value, value, value);
    }
}
