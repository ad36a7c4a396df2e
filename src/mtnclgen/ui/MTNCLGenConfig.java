package mtnclgen.ui;

import java.util.ArrayList;
import java.util.List;

/**
 * Data-Class to hold tool options, as read from the YAML run configuration.
 * Null bounds are unbounded.
 */
public class MTNCLGenConfig {

  public String equation = null;
  public String hvdd_equation = null;
  public String lvdd_equation = null;
  public int num_circuits = 1;

  public Constraints constraints = new Constraints();
  public Optimization optimization = new Optimization();
  public Gates gates = new Gates();
  public Polymorphic polymorphic = new Polymorphic();
  public Search search = new Search();
  public Output output = new Output();
  public List<String> gate_libraries = new ArrayList<>();

  public static class Constraints {
    public int min_gates = 0;
    public Integer max_gates = null;
    public Integer max_fanout = null;
    public Integer max_depth = null;
  }

  public static class Optimization {
    public String target = "area";
    public Weights weights = new Weights();
  }

  public static class Weights {
    public double area = 1.0;
    public double delay = 0.0;
    public double power = 0.0;
  }

  public static class Gates {
    public List<String> preferred = new ArrayList<>();
    public List<String> avoid = new ArrayList<>();
  }

  public static class Polymorphic {
    public boolean use_direct_mapping = true;
    public boolean use_alternative_mapping = true;
    public List<String> required_gates = new ArrayList<>();
    public List<String> alternative_gates = new ArrayList<>();
  }

  public static class Search {
    public int max_branches = 20000;
    public long time_limit_ms = 0;
  }

  public static class Output {
    public String directory = "results";
    public boolean generate_testbench = false;
    public boolean generate_report = true;
    public String module_name = "mtncl_circuit";
  }
}
