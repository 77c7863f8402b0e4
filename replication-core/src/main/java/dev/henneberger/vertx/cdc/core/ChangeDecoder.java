package dev.henneberger.vertx.cdc.core;

/**
 * Turns raw plugin output into change events. Implementations keep no state between calls.
 */
public interface ChangeDecoder {

  /**
   * @throws DecodeException if the payload is not what the plugin is expected to emit
   */
  DecodedSegment decode(RawSegment segment);

  boolean supportsPlugin(String plugin);
}
