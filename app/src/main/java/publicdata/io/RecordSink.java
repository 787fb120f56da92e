package publicdata.io;

import com.google.gson.JsonObject;
import java.io.Closeable;
import java.io.IOException;

/** Destination for output records. Callers own the sink and close it. */
public interface RecordSink extends Closeable {

  void write(JsonObject record) throws IOException;

  /** Sink that drops everything. */
  static RecordSink discard() {
    return new RecordSink() {
      @Override
      public void write(JsonObject record) {}

      @Override
      public void close() {}
    };
  }
}
