package publicdata.pipeline;

import java.util.Objects;

/** A function whose analysis was abandoned, with the reason. */
public record FunctionFailure(String function, String message) {

  public FunctionFailure {
    Objects.requireNonNull(function, "function");
    message = message == null ? "" : message;
  }
}
