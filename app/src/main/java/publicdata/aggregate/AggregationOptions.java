package publicdata.aggregate;

import java.util.Objects;

public record AggregationOptions(MissingResultPolicy missingPolicy) {

  public AggregationOptions {
    Objects.requireNonNull(missingPolicy, "missingPolicy");
  }

  public static AggregationOptions defaults() {
    return new AggregationOptions(MissingResultPolicy.UNKNOWN);
  }
}
