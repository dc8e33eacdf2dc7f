package inferline.model;

/**
 * 상태별 요청 수와 활성 프로바이더 수.
 */
public record QueueStats(
    long pending,
    long processing,
    long completed,
    long failed,
    long total,
    int activeProviders
) {}
