package livyrunner.batch.model;

/**
 * A Spark job of an application, as listed by the Spark monitoring API.
 */
public record SparkJob(String jobId, String status) {
}
