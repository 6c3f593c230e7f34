/**
 * Container-backed integration tests for the watcher engine.
 *
 * <h2>Test Structure</h2>
 * <ul>
 *   <li>{@link io.addresswatcher.engine.RedpandaStreamIntegrationTest} - connection manager and
 *       retrying reader against RedPanda, with events produced by the test</li>
 *   <li>{@link io.addresswatcher.engine.DebeziumPipelineIntegrationTest} - users table changes captured
 *       by Debezium and read back through the stream reader</li>
 * </ul>
 *
 * <h2>Key Differences</h2>
 * <table border="1">
 *   <tr>
 *     <th>Aspect</th>
 *     <th>RedpandaStreamIntegrationTest</th>
 *     <th>DebeziumPipelineIntegrationTest</th>
 *   </tr>
 *   <tr>
 *     <td>Messaging Platform</td>
 *     <td>RedPanda (RedpandaContainer)</td>
 *     <td>Kafka (KafkaContainer)</td>
 *   </tr>
 *   <tr>
 *     <td>Event Source</td>
 *     <td>Envelopes built from {@code envelopes/user-change.json}</td>
 *     <td>Debezium PostgreSQL connector</td>
 *   </tr>
 *   <tr>
 *     <td>Malformed Input</td>
 *     <td>Tombstones, invalid JSON and unknown operations mixed in</td>
 *     <td>Delete tombstones only</td>
 *   </tr>
 * </table>
 *
 * <p>Both classes are skipped when no Docker environment is available. {@link io.addresswatcher.engine.AppTest}
 * covers the entry point's shutdown hook without containers. Unit tests live next to the
 * packages they cover and need no containers.
 */
package io.addresswatcher.engine;
