package mtnclgen.circuit;

/**
 * A signal of a circuit graph. Driven either by a primary input, one of the shared control inputs (reset, sleep, supply
 * select) or exactly one node output.
 */
public final class Net {
  public enum Source { PRIMARY_INPUT, RESET, SLEEP, SUPPLY_SELECT, NODE }

  private final int id;
  private final String name;
  private final Source source;
  private final int producer;

  private Net(int id, String name, Source source, int producer) {
    this.id = id;
    this.name = name;
    this.source = source;
    this.producer = producer;
  }

  public static Net primaryInput(int id, String variable) { return new Net(id, variable, Source.PRIMARY_INPUT, -1); }
  public static Net reset(int id, String name) { return new Net(id, name, Source.RESET, -1); }
  public static Net sleep(int id, String name) { return new Net(id, name, Source.SLEEP, -1); }
  public static Net supplySelect(int id, String name) { return new Net(id, name, Source.SUPPLY_SELECT, -1); }
  public static Net nodeOutput(int id, String name, int producerNode) { return new Net(id, name, Source.NODE, producerNode); }

  public int getId() { return id; }
  public String getName() { return name; }
  public Source getSource() { return source; }
  public boolean isPrimaryInput() { return source == Source.PRIMARY_INPUT; }
  /** Reset, sleep or supply select: shared by every gate with that pin, never a data signal. */
  public boolean isControl() { return source != Source.PRIMARY_INPUT && source != Source.NODE; }
  /** Id of the driving node, or -1 if the net is not driven by a node. */
  public int getProducer() { return producer; }

  @Override
  public String toString() {
    return name + "#" + id;
  }
}
