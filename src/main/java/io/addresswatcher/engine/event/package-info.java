/**
 * Debezium change events for the users table and their decoder.
 */
package io.addresswatcher.engine.event;
