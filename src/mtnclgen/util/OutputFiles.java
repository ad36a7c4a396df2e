package mtnclgen.util;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import mtnclgen.GenerationOptions;
import mtnclgen.GenerationResult;
import mtnclgen.gatelib.Domain;
import mtnclgen.rank.CandidateResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/*
 * Writes the selected circuits of a run: circuit_<i>.v, circuit_<i>_tb.v and README.md.
 */
public class OutputFiles {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final File directory;
  private final String moduleName;
  private final boolean generateTestbench;
  private final boolean generateReport;
  private final Verilog verilog = new Verilog();

  public OutputFiles(File directory, String moduleName, boolean generateTestbench, boolean generateReport) {
    this.directory = directory;
    this.moduleName = moduleName;
    this.generateTestbench = generateTestbench;
    this.generateReport = generateReport;
  }

  /** @return the files written */
  public List<File> write(GenerationResult result, GenerationOptions options) throws IOException {
    if (!directory.isDirectory() && !directory.mkdirs())
      throw new IOException("Cannot create output directory " + directory);
    List<Domain> domains = result.isPolymorphic() ? List.of(Domain.HVDD, Domain.LVDD) : List.of(Domain.HVDD);
    List<File> written = new ArrayList<>();
    int index = 0;
    for (CandidateResult candidate : result.getSelected()) {
      written.add(WriteFile("circuit_" + index + ".v", verilog.netlist(candidate.getGraph(), moduleName)));
      if (generateTestbench)
        written.add(WriteFile("circuit_" + index + "_tb.v", verilog.testbench(candidate.getGraph(), moduleName, domains)));
      ++index;
    }
    if (generateReport)
      written.add(WriteFile("README.md", new ReportWriter().report(result, options)));
    return written;
  }

  private File WriteFile(String name, String content) throws IOException {
    File file = new File(directory, name);
    logger.info("Writing " + file);
    try (PrintWriter out = new PrintWriter(new OutputStreamWriter(new FileOutputStream(file), StandardCharsets.UTF_8))) {
      out.print(content);
      if (out.checkError())
        throw new IOException("Error writing " + file);
    }
    return file;
  }
}
