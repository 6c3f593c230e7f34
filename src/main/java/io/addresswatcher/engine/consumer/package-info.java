/**
 * Kafka side of the watcher: connection management and the read loop.
 *
 * <h2>Core Components</h2>
 *
 * <h3>{@link io.addresswatcher.engine.consumer.ConnectionManager}</h3>
 * Owns one broker connection for a topic partition:
 * <ul>
 *   <li>connects with exponential backoff, {@code retryDelay * 2^attempt} between attempts</li>
 *   <li>probes the connection on demand and from a background health check</li>
 *   <li>reconnects transparently when {@code getConnection()} finds the connection dead</li>
 * </ul>
 *
 * <h3>{@link io.addresswatcher.engine.consumer.StreamReader}</h3>
 * Fetches records one at a time, decodes them and hands each event to an
 * {@link io.addresswatcher.engine.consumer.EventHandler}. Bad records and handler failures are
 * logged and skipped; the loop ends only on cancellation.
 *
 * <h3>{@link io.addresswatcher.engine.consumer.RetryingReader}</h3>
 * Restarts a reader after any abnormal exit until cancelled.
 *
 * <h2>Seams</h2>
 * <table border="1">
 *   <tr><th>Interface</th><th>Production implementation</th></tr>
 *   <tr><td>{@link io.addresswatcher.engine.consumer.BrokerConnector}</td><td>{@link io.addresswatcher.engine.consumer.KafkaBrokerConnector}</td></tr>
 *   <tr><td>{@link io.addresswatcher.engine.consumer.RecordStreamFactory}</td><td>{@link io.addresswatcher.engine.consumer.KafkaRecordStream#open}</td></tr>
 *   <tr><td>{@link io.addresswatcher.engine.consumer.Sleeper}</td><td>{@link io.addresswatcher.engine.consumer.Sleeper#SYSTEM}</td></tr>
 * </table>
 */
package io.addresswatcher.engine.consumer;
