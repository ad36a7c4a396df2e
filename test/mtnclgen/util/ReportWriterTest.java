package mtnclgen.util;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import mtnclgen.GenerationOptions;
import mtnclgen.GenerationResult;
import mtnclgen.MTNCLGen;
import mtnclgen.drc.Constraints;
import mtnclgen.gatelib.StandardGates;
import mtnclgen.rank.Optimization;
import mtnclgen.synth.SynthesisOptions;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ReportWriterTest {

  @Test
  void testReport() throws Exception {
    GenerationOptions options = new GenerationOptions(3, new Constraints(2, null, null, null), Optimization.DEFAULT, SynthesisOptions.DEFAULT);
    GenerationResult result = new MTNCLGen(StandardGates.basicCatalog(), options).generate("A + B + C");
    String text = new ReportWriter().report(result, options);
    Assertions.assertTrue(text.startsWith("# MTNCL Circuit Generation Results"));
    Assertions.assertTrue(text.contains("- Boolean equation: `A + B + C`"));
    Assertions.assertTrue(text.contains("### Circuit 0"));
    Assertions.assertTrue(text.contains("### Circuit 1"));
    Assertions.assertTrue(text.contains("- TH12: 2"));
    Assertions.assertTrue(text.contains("## Rejected Candidates"));
    Assertions.assertTrue(text.contains("1 gates, at least 2 required"));
  }

  @Test
  void testOutputFiles(@TempDir Path dir) throws Exception {
    GenerationOptions options = GenerationOptions.DEFAULT.withNumCircuits(2);
    GenerationResult result = new MTNCLGen(StandardGates.basicCatalog(), options).generate("A + B + C");
    List<File> written = new OutputFiles(dir.toFile(), "mtncl_circuit", true, true).write(result, options);
    Assertions.assertEquals(5, written.size());
    Assertions.assertTrue(Files.readString(dir.resolve("circuit_0.v")).contains("TH13"));
    Assertions.assertTrue(Files.exists(dir.resolve("circuit_1_tb.v")));
    Assertions.assertTrue(Files.readString(dir.resolve("README.md")).contains("### Circuit 1"));
  }
}
