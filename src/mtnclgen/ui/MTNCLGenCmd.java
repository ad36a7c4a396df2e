package mtnclgen.ui;

import java.io.File;
import java.io.IOException;
import java.util.Arrays;
import mtnclgen.GenerationOptions;
import mtnclgen.GenerationResult;
import mtnclgen.MTNCLGen;
import mtnclgen.frontend.AlignmentException;
import mtnclgen.frontend.EquationSyntaxException;
import mtnclgen.gatelib.GateCatalog;
import mtnclgen.synth.InternalSynthesisError;
import mtnclgen.util.OutputFiles;
import org.apache.commons.cli.*;
import org.apache.logging.log4j.*;
import org.apache.logging.log4j.core.appender.*;
import org.apache.logging.log4j.core.config.Configurator;
import org.apache.logging.log4j.core.config.builder.api.*;
import org.apache.logging.log4j.core.config.builder.impl.*;

public class MTNCLGenCmd {
  // logging
  protected static Logger logger = LogManager.getLogger();

  // command line options
  static Options options = new Options();
  static {
    options.addOption(Option.builder("e").longOpt("equation").argName("equation").hasArg().desc("Boolean equation, e.g. \"A & (B + C)\"").build());
    options.addOption(Option.builder().longOpt("hvdd").argName("equation").hasArg().desc("Polymorphic mode: function at high supply voltage").build());
    options.addOption(Option.builder().longOpt("lvdd").argName("equation").hasArg().desc("Polymorphic mode: function at low supply voltage").build());
    options.addOption(Option.builder("n").longOpt("num-circuits").argName("count").hasArg().desc("Number of circuits to generate").build());
    options.addOption(Option.builder("c").longOpt("config").argName("config.yaml").hasArg().desc("YAML run configuration").build());
    options.addOption(Option.builder("g")
                          .longOpt("gates")
                          .argName("gates.yaml")
                          .hasArg()
                          .desc("YAML gate library, may be repeated; the built-in library is used if none is given")
                          .build());
    options.addOption(Option.builder("o").longOpt("outdir").argName("directory").hasArg().desc("Directory to generate output-files").build());
    options.addOption(Option.builder("t").longOpt("testbench").desc("Also write a self-checking testbench per circuit").build());
    options.addOption(Option.builder("h").longOpt("help").desc("Print this message").build());
    options.addOption(Option.builder("q").longOpt("quiet").desc("Turn off all messages").build());
    options.addOption(Option.builder("v").longOpt("verbose").desc("Verbose printing").build());
    options.addOption(Option.builder("vv").longOpt("vverbose").desc("Print debug information and enable -v").build());
  }

  // usage text
  private static HelpFormatter helper = new HelpFormatter();
  private static void printHelp() { helper.printHelp("mtnclgen - generate MTNCL threshold gate circuits for boolean equations", options); }

  public static void main(String[] args) {
    // console logging only; the level stays OFF until run() applies -q/-v/-vv
    ConfigurationBuilder<BuiltConfiguration> builder = ConfigurationBuilderFactory.newConfigurationBuilder();
    AppenderComponentBuilder appenderBuilder =
        builder.newAppender("Stdout", "CONSOLE").addAttribute("target", ConsoleAppender.Target.SYSTEM_OUT);
    appenderBuilder.add(builder.newLayout("PatternLayout").addAttribute("pattern", "%-5level: %msg%n%throwable"));
    builder.add(appenderBuilder);
    builder.add(builder.newRootLogger(Level.OFF).add(builder.newAppenderRef("Stdout")));
    Configurator.initialize(builder.build());
    logger = LogManager.getLogger();

    System.exit(run(args));
  }

  /**
   * Runs the tool.
   * @return the exit code: 0 if at least one circuit was written, 1 otherwise
   */
  public static int run(String[] args) {
    CommandLineParser parser = new DefaultParser();
    CommandLine line;
    try {
      // unknown options and missing arguments end up in the catch below
      line = parser.parse(options, args);
    } catch (ParseException exp) {
      // bad command line: report and show usage
      System.err.println(exp.getMessage());
      printHelp();
      return 1;
    }
    if (line.hasOption("h")) {
      printHelp();
      return 1;
    }

    // -v and -vv override -q
    Level logLvl = Level.INFO;
    if (line.hasOption("q"))
      logLvl = Level.OFF;
    if (line.hasOption("v"))
      logLvl = Level.DEBUG;
    if (line.hasOption("vv"))
      logLvl = Level.TRACE;
    Configurator.setAllLevels(LogManager.getRootLogger().getName(), logLvl);

    //////////   options   //////////
    MTNCLGenConfig cfg;
    GenerationOptions genOptions;
    GateCatalog catalog;
    try {
      cfg = line.hasOption("c") ? ConfigReader.read(new File(line.getOptionValue("c"))) : new MTNCLGenConfig();
      applyOverrides(line, cfg);
      genOptions = ConfigReader.toOptions(cfg);
      catalog = ConfigReader.loadCatalog(cfg);
    } catch (ConfigException e) {
      logger.error(e.getMessage());
      return 1;
    }

    boolean regular = cfg.equation != null;
    boolean polymorphic = cfg.hvdd_equation != null || cfg.lvdd_equation != null;
    if (regular == polymorphic || (polymorphic && (cfg.hvdd_equation == null || cfg.lvdd_equation == null))) {
      logger.error("Give either an equation or both an HVDD and an LVDD equation");
      printHelp();
      return 1;
    }

    //////////   generate   //////////
    MTNCLGen generator = new MTNCLGen(catalog, genOptions);
    GenerationResult result;
    try {
      result = regular ? generator.generate(cfg.equation) : generator.generatePolymorphic(cfg.hvdd_equation, cfg.lvdd_equation);
    } catch (EquationSyntaxException | AlignmentException e) {
      logger.error(e.getMessage());
      return 1;
    } catch (InternalSynthesisError e) {
      logger.fatal("Internal error: " + e.getMessage(), e);
      return 1;
    }
    if (result.isEmpty()) {
      logger.error("No circuit found for the given equation and constraints");
      result.getFailures().forEach(failure -> logger.info(failure.getMessage()));
      return 1;
    }

    OutputFiles out = new OutputFiles(new File(cfg.output.directory), cfg.output.module_name, cfg.output.generate_testbench,
                                      cfg.output.generate_report);
    try {
      out.write(result, genOptions);
    } catch (IOException e) {
      logger.error("Writing results failed: " + e.getMessage());
      return 1;
    }
    logger.info("Wrote {} circuit(s) to {}", result.getSelected().size(), cfg.output.directory);
    return 0;
  }

  /** Command line values take precedence over the configuration file. */
  static void applyOverrides(CommandLine line, MTNCLGenConfig cfg) throws ConfigException {
    if (line.hasOption("e"))
      cfg.equation = line.getOptionValue("e");
    if (line.hasOption("hvdd"))
      cfg.hvdd_equation = line.getOptionValue("hvdd");
    if (line.hasOption("lvdd"))
      cfg.lvdd_equation = line.getOptionValue("lvdd");
    if (line.hasOption("e") && (line.hasOption("hvdd") || line.hasOption("lvdd")))
      throw new ConfigException("Options -e and --hvdd/--lvdd are mutually exclusive");
    if (line.hasOption("e")) {
      cfg.hvdd_equation = null;
      cfg.lvdd_equation = null;
    } else if (line.hasOption("hvdd") || line.hasOption("lvdd")) {
      cfg.equation = null;
    }
    if (line.hasOption("n")) {
      try {
        cfg.num_circuits = Integer.parseInt(line.getOptionValue("n"));
      } catch (NumberFormatException e) {
        throw new ConfigException("Invalid number of circuits: " + line.getOptionValue("n"));
      }
    }
    if (line.hasOption("g"))
      cfg.gate_libraries = Arrays.asList(line.getOptionValues("g"));
    if (cfg.output == null)
      cfg.output = new MTNCLGenConfig.Output();
    if (line.hasOption("o"))
      cfg.output.directory = line.getOptionValue("o");
    if (line.hasOption("t"))
      cfg.output.generate_testbench = true;
  }
}
