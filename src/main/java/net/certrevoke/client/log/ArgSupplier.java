package net.certrevoke.client.log;

/**
 * Log argument computed only when the message is actually emitted, e.g. {@code
 * logger.trace("Serials: {}", (ArgSupplier) list::getRevokedSerials)}.
 */
@FunctionalInterface
public interface ArgSupplier {
  Object get();
}
