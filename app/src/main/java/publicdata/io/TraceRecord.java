package publicdata.io;

import com.google.gson.JsonObject;
import java.util.List;
import java.util.Objects;
import publicdata.model.ProgramPoint;
import publicdata.model.Transmitter;
import publicdata.model.TransmitterKind;

/** One instruction-trace record as emitted by the front end. */
public record TraceRecord(
    String function,
    String block,
    ProgramPoint pp,
    String opcode,
    String def,
    List<String> uses,
    Transmitter transmitter,
    String defType,
    List<String> useTypes,
    String icmpPredicate,
    String fcmpPredicate,
    int line) {

  public TraceRecord {
    Objects.requireNonNull(function, "function");
    Objects.requireNonNull(block, "block");
    Objects.requireNonNull(pp, "pp");
    Objects.requireNonNull(opcode, "opcode");
    uses = List.copyOf(uses);
    useTypes = useTypes == null ? List.of() : List.copyOf(useTypes);
  }

  public static TraceRecord fromJson(JsonObject obj, int line) {
    String fn = JsonFields.requireString(obj, "fn", line);
    String bb = JsonFields.requireString(obj, "bb", line);
    String ppText = JsonFields.requireString(obj, "pp", line);
    ProgramPoint pp;
    try {
      pp = ProgramPoint.parse(ppText);
    } catch (IllegalArgumentException ex) {
      throw new MalformedRecordException("Invalid program point '" + ppText + "'", line, "pp", ex);
    }
    if (!pp.function().equals(fn) || !pp.block().equals(bb)) {
      throw new MalformedRecordException(
          "Program point " + ppText + " does not belong to " + fn + ":" + bb, line, "pp");
    }
    List<String> uses = JsonFields.stringList(obj, "uses", line);
    Transmitter tx = null;
    JsonObject txObj = JsonFields.optObject(obj, "tx", line);
    if (txObj != null) {
      String kindName = JsonFields.requireString(txObj, "kind", line);
      TransmitterKind kind =
          TransmitterKind.fromWire(kindName)
              .orElseThrow(
                  () ->
                      new MalformedRecordException(
                          "Unknown transmitter kind '" + kindName + "'", line, "tx.kind"));
      int which = JsonFields.optInt(txObj, "which", kind.defaultOperand(), line);
      if (which < 0) {
        throw new MalformedRecordException("Negative operand index", line, "tx.which");
      }
      if (which >= uses.size()) {
        throw new MalformedRecordException(
            "Operand index " + which + " out of range for " + uses.size() + " uses",
            line,
            "tx.which");
      }
      tx = new Transmitter(kind, which);
    }
    return new TraceRecord(
        fn,
        bb,
        pp,
        JsonFields.requireString(obj, "op", line),
        JsonFields.optString(obj, "def", line),
        uses,
        tx,
        JsonFields.optString(obj, "def_ty", line),
        JsonFields.stringList(obj, "use_tys", line),
        JsonFields.optString(obj, "icmp_pred", line),
        JsonFields.optString(obj, "fcmp_pred", line),
        line);
  }

  public JsonObject toJson() {
    JsonObject obj = new JsonObject();
    obj.addProperty("fn", function);
    obj.addProperty("bb", block);
    obj.addProperty("pp", pp.key());
    obj.addProperty("op", opcode);
    if (def != null) {
      obj.addProperty("def", def);
    }
    obj.add("uses", JsonFields.strings(uses));
    if (transmitter != null) {
      JsonObject tx = new JsonObject();
      tx.addProperty("kind", transmitter.kind().wireName());
      tx.addProperty("which", transmitter.operandIndex());
      obj.add("tx", tx);
    }
    if (defType != null) {
      obj.addProperty("def_ty", defType);
    }
    if (!useTypes.isEmpty()) {
      obj.add("use_tys", JsonFields.strings(useTypes));
    }
    if (icmpPredicate != null) {
      obj.addProperty("icmp_pred", icmpPredicate);
    }
    if (fcmpPredicate != null) {
      obj.addProperty("fcmp_pred", fcmpPredicate);
    }
    return obj;
  }
}
