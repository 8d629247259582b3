package livyrunner.batch.client;

/**
 * Remote endpoint families a batch lifecycle talks to.
 */
public enum RemoteService {
    LIVY,
    SPARK,
    YARN
}
