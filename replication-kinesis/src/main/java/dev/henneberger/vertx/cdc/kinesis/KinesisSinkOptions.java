package dev.henneberger.vertx.cdc.kinesis;

import dev.henneberger.vertx.cdc.core.OptionValidation;
import io.vertx.core.json.JsonObject;
import java.net.URI;
import java.time.Duration;

/**
 * Target stream and client settings for {@link KinesisRecordSink}.
 */
public class KinesisSinkOptions {

  public static final Duration DEFAULT_API_CALL_TIMEOUT = Duration.ofSeconds(30);

  private String streamName;
  private String region;
  private String endpointOverride;
  private Duration apiCallTimeout;

  public KinesisSinkOptions() {
    apiCallTimeout = DEFAULT_API_CALL_TIMEOUT;
  }

  public KinesisSinkOptions(JsonObject json) {
    this();
    if (json.containsKey("streamName")) {
      streamName = json.getString("streamName");
    }
    if (json.containsKey("region")) {
      region = json.getString("region");
    }
    if (json.containsKey("endpointOverride")) {
      endpointOverride = json.getString("endpointOverride");
    }
    if (json.containsKey("apiCallTimeoutMs")) {
      apiCallTimeout = Duration.ofMillis(json.getLong("apiCallTimeoutMs"));
    }
  }

  public KinesisSinkOptions(KinesisSinkOptions other) {
    this.streamName = other.streamName;
    this.region = other.region;
    this.endpointOverride = other.endpointOverride;
    this.apiCallTimeout = other.apiCallTimeout;
  }

  public String getStreamName() {
    return streamName;
  }

  public KinesisSinkOptions setStreamName(String streamName) {
    this.streamName = streamName;
    return this;
  }

  /**
   * AWS region; when unset the SDK's default region chain applies.
   */
  public String getRegion() {
    return region;
  }

  public KinesisSinkOptions setRegion(String region) {
    this.region = region;
    return this;
  }

  /**
   * Endpoint URI used instead of the regional one, e.g. LocalStack.
   */
  public String getEndpointOverride() {
    return endpointOverride;
  }

  public KinesisSinkOptions setEndpointOverride(String endpointOverride) {
    this.endpointOverride = endpointOverride;
    return this;
  }

  public Duration getApiCallTimeout() {
    return apiCallTimeout;
  }

  public KinesisSinkOptions setApiCallTimeout(Duration apiCallTimeout) {
    this.apiCallTimeout = apiCallTimeout;
    return this;
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject()
      .put("streamName", streamName)
      .put("apiCallTimeoutMs", apiCallTimeout.toMillis());
    if (region != null) {
      json.put("region", region);
    }
    if (endpointOverride != null) {
      json.put("endpointOverride", endpointOverride);
    }
    return json;
  }

  public void validate() {
    OptionValidation.require("streamName", streamName);
    OptionValidation.requirePositive("apiCallTimeout", apiCallTimeout);
    if (endpointOverride != null) {
      URI uri;
      try {
        uri = URI.create(endpointOverride);
      } catch (IllegalArgumentException e) {
        throw new IllegalArgumentException("endpointOverride '" + endpointOverride + "' is not a URI", e);
      }
      if (uri.getScheme() == null || uri.getHost() == null) {
        throw new IllegalArgumentException("endpointOverride '" + endpointOverride + "' needs a scheme and host");
      }
    }
  }
}
