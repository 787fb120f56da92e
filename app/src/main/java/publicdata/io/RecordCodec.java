package publicdata.io;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import java.util.ArrayList;
import java.util.List;
import publicdata.aggregate.AggregatedPublicness;
import publicdata.cond.CondExpr;
import publicdata.model.Block;
import publicdata.model.Decision;
import publicdata.model.FuncSummary;
import publicdata.model.Path;
import publicdata.model.PathSummary;
import publicdata.model.PpCoverage;
import publicdata.model.ProgramPoint;
import publicdata.model.Terminator;
import publicdata.model.ValueId;
import publicdata.verify.Publicness;
import publicdata.verify.PublicnessResult;

/** JSON encoding of the boundary records. Decoders report schema violations by line. */
public final class RecordCodec {

  private RecordCodec() {}

  // ---- program points and values

  static ProgramPoint pp(JsonObject obj, String field, int line) {
    String raw = JsonFields.requireString(obj, field, line);
    return parsePp(raw, field, line);
  }

  static ProgramPoint optPp(JsonObject obj, String field, int line) {
    String raw = JsonFields.optString(obj, field, line);
    return raw == null ? null : parsePp(raw, field, line);
  }

  static ProgramPoint parsePp(String raw, String field, int line) {
    try {
      return ProgramPoint.parse(raw);
    } catch (IllegalArgumentException ex) {
      throw new MalformedRecordException("Invalid program point '" + raw + "'", line, field, ex);
    }
  }

  static ValueId value(String raw, String field, int line) {
    try {
      return ValueId.parse(raw);
    } catch (IllegalArgumentException ex) {
      throw new MalformedRecordException("Invalid value id '" + raw + "'", line, field, ex);
    }
  }

  static ValueId requireValue(JsonObject obj, String field, int line) {
    return value(JsonFields.requireString(obj, field, line), field, line);
  }

  // ---- CFG

  public static JsonObject block(String function, Block block) {
    JsonObject obj = kind(RecordKinds.BLOCK, function);
    obj.addProperty("bb", block.label());
    obj.add("succs", JsonFields.strings(block.successors()));
    Terminator t = block.terminator();
    if (t.pp() != null) {
      obj.addProperty("term_pp", t.pp().key());
      obj.addProperty("term_op", terminatorOpcode(t));
    }
    if (t instanceof Terminator.ConditionalBranch br) {
      obj.addProperty("cond", br.condition().render());
    } else if (t instanceof Terminator.Switch sw) {
      obj.addProperty("cond", sw.condition().render());
    } else if (t instanceof Terminator.Indirect ind) {
      obj.addProperty("target", ind.target().render());
    }
    return obj;
  }

  /** Edge records of one block, in successor declaration order. */
  public static List<JsonObject> edges(String function, Block block) {
    List<JsonObject> out = new ArrayList<>();
    Terminator t = block.terminator();
    if (t instanceof Terminator.ConditionalBranch br) {
      out.add(condEdge(function, block, br, br.trueSuccessor(), true));
      out.add(condEdge(function, block, br, br.falseSuccessor(), false));
    } else if (t instanceof Terminator.Switch sw) {
      for (Terminator.SwitchCase c : sw.cases()) {
        JsonObject e = edge(function, block, c.successor(), EdgeRecord.SWITCH);
        e.addProperty("cond", sw.condition().render());
        e.addProperty("case", c.value().render());
        out.add(e);
      }
      if (sw.defaultSuccessor() != null) {
        JsonObject e = edge(function, block, sw.defaultSuccessor(), EdgeRecord.SWITCH);
        e.addProperty("cond", sw.condition().render());
        e.addProperty("default", true);
        out.add(e);
      }
    } else if (t instanceof Terminator.Indirect ind) {
      for (String succ : ind.successors()) {
        JsonObject e = edge(function, block, succ, EdgeRecord.INDIRECT);
        e.addProperty("target", ind.target().render());
        out.add(e);
      }
    } else {
      for (String succ : t.successors()) {
        out.add(edge(function, block, succ, EdgeRecord.UNCOND));
      }
    }
    return out;
  }

  private static JsonObject condEdge(
      String function, Block block, Terminator.ConditionalBranch br, String to, boolean sense) {
    JsonObject e = edge(function, block, to, EdgeRecord.COND);
    e.addProperty("cond", br.condition().render());
    e.addProperty("sense", Boolean.toString(sense));
    return e;
  }

  private static JsonObject edge(String function, Block block, String to, String branch) {
    JsonObject e = kind(RecordKinds.EDGE, function);
    e.addProperty("from", block.label());
    e.addProperty("to", to);
    if (block.terminator().pp() != null) {
      e.addProperty("term_pp", block.terminator().pp().key());
    }
    e.addProperty("branch", branch);
    return e;
  }

  private static String terminatorOpcode(Terminator t) {
    if (t instanceof Terminator.Leaf leaf) {
      return leaf.opcode();
    }
    if (t instanceof Terminator.Jump jump) {
      return jump.opcode();
    }
    if (t instanceof Terminator.ConditionalBranch) {
      return "br";
    }
    if (t instanceof Terminator.Switch) {
      return "switch";
    }
    return "indirectbr";
  }

  // ---- conditions

  public static JsonObject condExpr(CondExpr expr) {
    JsonObject obj = new JsonObject();
    if (expr instanceof CondExpr.And and) {
      obj.addProperty("op", "and");
      JsonArray terms = new JsonArray();
      for (CondExpr t : and.terms()) {
        terms.add(condExpr(t));
      }
      obj.add("terms", terms);
    } else if (expr instanceof CondExpr.Equals eq) {
      obj.addProperty("op", "==");
      obj.addProperty("lhs", eq.lhs().render());
      obj.addProperty("rhs", eq.rhs().render());
    } else {
      CondExpr.NotEquals ne = (CondExpr.NotEquals) expr;
      obj.addProperty("op", "!=");
      obj.addProperty("lhs", ne.lhs().render());
      obj.addProperty("rhs", ne.rhs().render());
    }
    return obj;
  }

  public static CondExpr parseCondExpr(JsonObject obj, int line) {
    String op = JsonFields.requireString(obj, "op", line);
    switch (op) {
      case "and":
        {
          JsonArray terms = JsonFields.optArray(obj, "terms", line);
          if (terms == null || terms.size() < 2) {
            throw new MalformedRecordException("Conjunction needs two or more terms", line, "terms");
          }
          List<CondExpr> parsed = new ArrayList<>(terms.size());
          for (JsonElement e : terms) {
            if (!e.isJsonObject()) {
              throw new MalformedRecordException("Expected a condition object", line, "terms");
            }
            parsed.add(parseCondExpr(e.getAsJsonObject(), line));
          }
          return new CondExpr.And(parsed);
        }
      case "==":
        return new CondExpr.Equals(requireValue(obj, "lhs", line), requireValue(obj, "rhs", line));
      case "!=":
        return new CondExpr.NotEquals(
            requireValue(obj, "lhs", line), requireValue(obj, "rhs", line));
      default:
        throw new MalformedRecordException("Unknown condition operator '" + op + "'", line, "op");
    }
  }

  // ---- paths

  public static JsonObject decision(Decision d) {
    JsonObject obj = new JsonObject();
    if (d.pp() != null) {
      obj.addProperty("pp", d.pp().key());
    }
    obj.addProperty("kind", d.kind());
    obj.addProperty("succ", d.successor());
    if (d instanceof Decision.Branch br) {
      obj.addProperty("cond", br.condition().render());
      obj.addProperty("sense", Boolean.toString(br.sense()));
    } else if (d instanceof Decision.SwitchCase sc) {
      obj.addProperty("cond", sc.condition().render());
      obj.addProperty("case", sc.caseValue().render());
    } else if (d instanceof Decision.SwitchDefault sd) {
      obj.addProperty("cond", sd.condition().render());
      obj.addProperty("default", true);
      JsonArray cases = new JsonArray(sd.cases().size());
      sd.cases().forEach(c -> cases.add(c.render()));
      obj.add("cases", cases);
    } else if (d instanceof Decision.Indirect ind) {
      obj.addProperty("target", ind.target().render());
    }
    return obj;
  }

  public static Decision parseDecision(JsonObject obj, int line) {
    ProgramPoint pp = optPp(obj, "pp", line);
    String kind = JsonFields.requireString(obj, "kind", line);
    String succ = JsonFields.requireString(obj, "succ", line);
    switch (kind) {
      case "uncond":
        return new Decision.Unconditional(pp, succ);
      case "br":
        {
          Boolean sense = JsonFields.optBoolean(obj, "sense", line);
          if (sense == null) {
            throw new MalformedRecordException("Branch decision without sense", line, "sense");
          }
          return new Decision.Branch(pp, succ, requireValue(obj, "cond", line), sense);
        }
      case "switch":
        {
          ValueId cond = requireValue(obj, "cond", line);
          if (JsonFields.flag(obj, "default", line)) {
            List<ValueId> cases = new ArrayList<>();
            for (String c : JsonFields.stringList(obj, "cases", line)) {
              cases.add(value(c, "cases", line));
            }
            return new Decision.SwitchDefault(pp, succ, cond, cases);
          }
          return new Decision.SwitchCase(pp, succ, cond, requireValue(obj, "case", line));
        }
      case "indirect":
      case "indirectbr":
        return new Decision.Indirect(pp, succ, requireValue(obj, "target", line));
      default:
        throw new MalformedRecordException("Unknown decision kind '" + kind + "'", line, "kind");
    }
  }

  public static JsonObject path(Path path) {
    JsonObject obj = kind(RecordKinds.PATH, path.function());
    obj.addProperty("path_id", path.id());
    obj.add("bbs", JsonFields.strings(path.blocks()));
    JsonArray decisions = new JsonArray(path.decisions().size());
    path.decisions().forEach(d -> decisions.add(decision(d)));
    obj.add("decisions", decisions);
    if (!path.ppSeq().isEmpty()) {
      JsonArray seq = new JsonArray(path.ppSeq().size());
      path.ppSeq().forEach(pp -> seq.add(pp.key()));
      obj.add("pp_seq", seq);
    }
    if (!path.conditionText().isEmpty()) {
      obj.add("path_cond", JsonFields.strings(path.conditionText()));
    }
    if (!path.conditionExprs().isEmpty()) {
      JsonArray exprs = new JsonArray(path.conditionExprs().size());
      path.conditionExprs().forEach(e -> exprs.add(condExpr(e)));
      obj.add("path_cond_json", exprs);
    }
    return obj;
  }

  public static Path parsePath(JsonObject obj, int line) {
    String fn = JsonFields.requireString(obj, "fn", line);
    int id = JsonFields.requireInt(obj, "path_id", line);
    List<String> bbs = JsonFields.stringList(obj, "bbs", line);
    if (bbs.isEmpty()) {
      throw new MalformedRecordException("Path without blocks", line, "bbs");
    }
    List<Decision> decisions = new ArrayList<>();
    JsonArray decArray = JsonFields.optArray(obj, "decisions", line);
    if (decArray != null) {
      for (JsonElement e : decArray) {
        if (!e.isJsonObject()) {
          throw new MalformedRecordException("Expected a decision object", line, "decisions");
        }
        decisions.add(parseDecision(e.getAsJsonObject(), line));
      }
    }
    List<ProgramPoint> ppSeq = new ArrayList<>();
    for (String raw : JsonFields.stringList(obj, "pp_seq", line)) {
      ppSeq.add(parsePp(raw, "pp_seq", line));
    }
    List<CondExpr> exprs = new ArrayList<>();
    JsonArray condJson = JsonFields.optArray(obj, "path_cond_json", line);
    if (condJson != null) {
      for (JsonElement e : condJson) {
        if (!e.isJsonObject()) {
          throw new MalformedRecordException("Expected a condition object", line, "path_cond_json");
        }
        exprs.add(parseCondExpr(e.getAsJsonObject(), line));
      }
    }
    return new Path(
        fn, id, bbs, decisions, ppSeq, JsonFields.stringList(obj, "path_cond", line), exprs);
  }

  public static JsonObject coverage(PpCoverage c) {
    JsonObject obj = kind(RecordKinds.PP_COVERAGE, c.function());
    obj.addProperty("pp", c.pp().key());
    obj.addProperty("path_count", c.pathCount());
    obj.add("path_ids", JsonFields.ints(c.pathIds()));
    obj.addProperty("truncated", c.truncated());
    return obj;
  }

  public static PpCoverage parseCoverage(JsonObject obj, int line) {
    List<Integer> ids = JsonFields.intList(obj, "path_ids", line);
    return new PpCoverage(
        JsonFields.requireString(obj, "fn", line),
        pp(obj, "pp", line),
        JsonFields.optInt(obj, "path_count", ids.size(), line),
        ids,
        JsonFields.flag(obj, "truncated", line));
  }

  public static JsonObject pathSummary(PathSummary s) {
    JsonObject obj = kind(RecordKinds.PATH_SUMMARY, s.function());
    obj.addProperty("paths_emitted", s.pathsEmitted());
    if (s.disabled()) {
      obj.addProperty("disabled", true);
      obj.addProperty("max_paths", s.maxPaths());
      obj.addProperty("max_depth", s.maxDepth());
      obj.addProperty("max_loop_iters", s.maxLoopIters());
      return obj;
    }
    obj.addProperty("truncated", s.truncated());
    obj.addProperty("max_paths", s.maxPaths());
    obj.addProperty("max_depth", s.maxDepth());
    obj.addProperty("max_loop_iters", s.maxLoopIters());
    obj.addProperty("cutoff_depth", s.cutoffDepth());
    obj.addProperty("cutoff_loop", s.cutoffLoop());
    obj.addProperty("const_pruned_br", s.constPrunedBranch());
    obj.addProperty("const_pruned_switch", s.constPrunedSwitch());
    obj.addProperty("const_pruned_indirect", s.constPrunedIndirect());
    obj.addProperty("dfs_calls", s.dfsCalls());
    obj.addProperty("dfs_leaves", s.dfsLeaves());
    obj.addProperty("dfs_prune_max_paths", s.pruneMaxPaths());
    obj.addProperty("dfs_prune_max_depth", s.pruneMaxDepth());
    obj.addProperty("dfs_prune_loop", s.pruneLoop());
    return obj;
  }

  public static PathSummary parsePathSummary(JsonObject obj, int line) {
    return new PathSummary(
        JsonFields.requireString(obj, "fn", line),
        JsonFields.flag(obj, "disabled", line),
        JsonFields.optInt(obj, "paths_emitted", 0, line),
        JsonFields.flag(obj, "truncated", line),
        JsonFields.optInt(obj, "max_paths", 0, line),
        JsonFields.optInt(obj, "max_depth", 0, line),
        JsonFields.optInt(obj, "max_loop_iters", 0, line),
        JsonFields.flag(obj, "cutoff_depth", line),
        JsonFields.flag(obj, "cutoff_loop", line),
        JsonFields.optLong(obj, "const_pruned_br", line),
        JsonFields.optLong(obj, "const_pruned_switch", line),
        JsonFields.optLong(obj, "const_pruned_indirect", line),
        JsonFields.optLong(obj, "dfs_calls", line),
        JsonFields.optLong(obj, "dfs_leaves", line),
        JsonFields.optLong(obj, "dfs_prune_max_paths", line),
        JsonFields.optLong(obj, "dfs_prune_max_depth", line),
        JsonFields.optLong(obj, "dfs_prune_loop", line));
  }

  public static JsonObject funcSummary(FuncSummary s) {
    JsonObject obj = kind(RecordKinds.FUNC_SUMMARY, s.function());
    obj.addProperty("inst_count", s.instCount());
    obj.addProperty("bb_count", s.blockCount());
    obj.addProperty("tx_count", s.transmitterCount());
    obj.addProperty("trace_emitted", s.traceEmitted());
    obj.addProperty("trace_truncated", s.traceTruncated());
    obj.addProperty("trace_max_inst", s.traceMaxInst());
    return obj;
  }

  public static FuncSummary parseFuncSummary(JsonObject obj, int line) {
    return new FuncSummary(
        JsonFields.requireString(obj, "fn", line),
        JsonFields.optInt(obj, "inst_count", 0, line),
        JsonFields.optInt(obj, "bb_count", 0, line),
        JsonFields.optInt(obj, "tx_count", 0, line),
        JsonFields.optInt(obj, "trace_emitted", 0, line),
        JsonFields.flag(obj, "trace_truncated", line),
        JsonFields.optInt(obj, "trace_max_inst", 0, line));
  }

  // ---- results

  public static JsonObject publicness(PublicnessResult r) {
    JsonObject obj = kind(RecordKinds.PATH_PUBLICNESS, r.function());
    obj.addProperty("path_id", r.pathId());
    obj.addProperty("pp", r.pp().key());
    obj.addProperty("value", r.value().render());
    obj.addProperty("public", r.publicness().toWire());
    return obj;
  }

  public static PublicnessResult parsePublicness(JsonObject obj, int line) {
    if (!obj.has("public")) {
      throw new MalformedRecordException("Missing required field", line, "public");
    }
    return new PublicnessResult(
        JsonFields.requireString(obj, "fn", line),
        JsonFields.requireInt(obj, "path_id", line),
        pp(obj, "pp", line),
        requireValue(obj, "value", line),
        Publicness.fromWire(JsonFields.optBoolean(obj, "public", line)));
  }

  public static JsonObject aggregated(AggregatedPublicness a) {
    JsonObject obj = kind(RecordKinds.PUBLIC_AT_POINT, a.function());
    obj.addProperty("pp", a.pp().key());
    obj.addProperty("value", a.value().render());
    obj.addProperty("public", a.publicness().toWire());
    obj.addProperty("total_paths", a.totalPaths());
    obj.addProperty("missing_paths", a.missingPaths());
    obj.addProperty("truncated", a.truncated());
    return obj;
  }

  private static JsonObject kind(String kind, String function) {
    JsonObject obj = new JsonObject();
    obj.addProperty("kind", kind);
    obj.addProperty("fn", function);
    return obj;
  }
}
