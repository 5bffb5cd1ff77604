package novt.tools.timeline;

public enum AveragingMethod {
    MEAN,
    MODE
}
