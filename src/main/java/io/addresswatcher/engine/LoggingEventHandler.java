package io.addresswatcher.engine;

import io.addresswatcher.engine.consumer.EventHandler;
import io.addresswatcher.engine.event.ChangeEvent;
import io.addresswatcher.engine.event.UserRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default handler of the watcher process: logs every user change.
 */
final class LoggingEventHandler implements EventHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(LoggingEventHandler.class);

    @Override
    public void handle(ChangeEvent event) {
        UserRow row = event.effectiveRow();
        switch (event.operation()) {
            case CREATE -> LOGGER.info("User created: {} (wallet {})", row.email(), row.walletAddress());
            case READ -> LOGGER.info("User snapshot: {} (wallet {})", row.email(), row.walletAddress());
            case UPDATE -> LOGGER.info("User updated: {} (wallet {}, subscribed {})",
                    row.email(), row.walletAddress(), row.subscribed());
            case DELETE -> LOGGER.info("User deleted: {} (wallet {})", row.email(), row.walletAddress());
        }
    }
}
