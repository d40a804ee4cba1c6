package io.intellixity.tabula.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.intellixity.tabula.convert.ConversionException;
import io.intellixity.tabula.convert.TableBuilder;
import io.intellixity.tabula.ddl.DdlDialect;
import io.intellixity.tabula.ddl.DdlDialects;
import io.intellixity.tabula.ddl.DdlOptions;
import io.intellixity.tabula.diff.SchemaChangeException;
import io.intellixity.tabula.diff.ShapeDiff;
import io.intellixity.tabula.diff.TableChange;
import io.intellixity.tabula.diff.TableChanges;
import io.intellixity.tabula.schema.Table;
import io.intellixity.tabula.shape.Shape;
import io.intellixity.tabula.shape.json.ShapeJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * CLI:
 *   TabulaMain [--dialect postgres] [--schema s] [--if-not-exists] [--json] <shape.json>...
 *   TabulaMain diff [--dialect postgres] [--schema s] <from.json> <to.json>
 *
 * Exit codes: 0 ok, 1 conversion or input error, 2 usage error.
 */
public final class TabulaMain {
  private static final Logger log = LoggerFactory.getLogger(TabulaMain.class);

  static final String USAGE = String.join("\n",
      "Usage: TabulaMain [--dialect <id>] [--schema <name>] [--if-not-exists] [--json] <shape.json>...",
      "       TabulaMain diff [--dialect <id>] [--schema <name>] <from.json> <to.json>");

  private TabulaMain() {}

  public static void main(String[] args) {
    int code = run(args, System.out, System.err);
    if (code != 0) System.exit(code);
  }

  static int run(String[] args, PrintStream out, PrintStream err) {
    Options o;
    try {
      o = Options.parse(args);
    } catch (IllegalArgumentException e) {
      err.println(e.getMessage());
      err.println(USAGE);
      return 2;
    }
    if (o.help) {
      out.println(USAGE);
      return 0;
    }

    DdlDialect dialect;
    try {
      dialect = new DdlDialects().forId(o.dialect);
    } catch (IllegalArgumentException e) {
      err.println(e.getMessage());
      return 2;
    }
    DdlOptions ddl = new DdlOptions(o.schema, o.ifNotExists);

    try {
      if (o.diff) {
        Shape from = ShapeJson.read(o.files.get(0));
        Shape to = ShapeJson.read(o.files.get(1));
        TableChange change = new TableChanges().plan(ShapeDiff.between(from, to));
        out.println(dialect.alterTable(change, ddl));
        return 0;
      }

      TableBuilder builder = new TableBuilder();
      List<Table> tables = new ArrayList<>();
      for (Path file : o.files) {
        tables.add(builder.convert(ShapeJson.read(file)));
        if (log.isDebugEnabled()) log.debug("tabula.cli op=convert file={}", file);
      }

      if (o.json) {
        out.println(ShapeJson.mapper().writeValueAsString(tables));
      } else {
        List<String> ddls = new ArrayList<>();
        for (Table t : tables) ddls.add(dialect.createTable(t, ddl));
        out.println(String.join("\n\n", ddls));
      }
      return 0;
    } catch (ConversionException | SchemaChangeException | IllegalArgumentException
             | UncheckedIOException | JsonProcessingException e) {
      err.println("error: " + e.getMessage());
      return 1;
    }
  }

  /** Parsed command line. */
  static final class Options {
    String dialect = "postgres";
    String schema;
    boolean ifNotExists;
    boolean json;
    boolean diff;
    boolean help;
    final List<Path> files = new ArrayList<>();

    static Options parse(String[] args) {
      Options o = new Options();
      int i = 0;
      if (args.length > 0 && "diff".equals(args[0])) {
        o.diff = true;
        i = 1;
      }
      for (; i < args.length; i++) {
        String a = args[i];
        switch (a) {
          case "-h", "--help" -> o.help = true;
          case "--dialect" -> o.dialect = value(args, ++i, a);
          case "--schema" -> o.schema = value(args, ++i, a);
          case "--if-not-exists" -> o.ifNotExists = true;
          case "--json" -> o.json = true;
          default -> {
            if (a.startsWith("--")) throw new IllegalArgumentException("Unknown option: " + a);
            o.files.add(Paths.get(a));
          }
        }
      }
      if (o.help) return o;
      if (o.diff) {
        if (o.files.size() != 2) throw new IllegalArgumentException("diff needs exactly two shape files");
        if (o.json || o.ifNotExists) throw new IllegalArgumentException("--json and --if-not-exists do not apply to diff");
      } else if (o.files.isEmpty()) {
        throw new IllegalArgumentException("No shape files given");
      }
      return o;
    }

    private static String value(String[] args, int i, String option) {
      if (i >= args.length || args[i].startsWith("--")) throw new IllegalArgumentException(option + " needs a value");
      return args[i];
    }
  }
}
