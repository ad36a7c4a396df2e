package mtnclgen.ui;

import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MTNCLGenCmdTest {

  @Test
  void testRegular(@TempDir Path dir) throws Exception {
    int code = MTNCLGenCmd.run(new String[] {"-q", "-e", "A & B", "-n", "2", "-t", "-o", dir.toString()});
    Assertions.assertEquals(0, code);
    Assertions.assertTrue(Files.readString(dir.resolve("circuit_0.v")).contains("TH22"));
    Assertions.assertTrue(Files.exists(dir.resolve("circuit_0_tb.v")));
    Assertions.assertTrue(Files.exists(dir.resolve("README.md")));
  }

  @Test
  void testPolymorphic(@TempDir Path dir) throws Exception {
    int code = MTNCLGenCmd.run(new String[] {"-q", "--hvdd", "A + B", "--lvdd", "A & B", "-o", dir.toString()});
    Assertions.assertEquals(0, code);
    Assertions.assertTrue(Files.readString(dir.resolve("circuit_0.v")).contains("TH12m_TH22m"));
  }

  @Test
  void testConfigFile(@TempDir Path dir) throws Exception {
    Path config = dir.resolve("run.yaml");
    Files.writeString(config, "equation: A + B + C\nnum_circuits: 3\noutput: {directory: " + dir.resolve("out") + "}\n");
    Assertions.assertEquals(0, MTNCLGenCmd.run(new String[] {"-q", "-c", config.toString()}));
    Assertions.assertTrue(Files.exists(dir.resolve("out").resolve("circuit_2.v")));
  }

  @Test
  void testFailures(@TempDir Path dir) {
    Assertions.assertEquals(1, MTNCLGenCmd.run(new String[] {"-q", "-e", "A & !B", "-o", dir.toString()}));
    Assertions.assertEquals(1, MTNCLGenCmd.run(new String[] {"-q", "-o", dir.toString()}));
    Assertions.assertEquals(1, MTNCLGenCmd.run(new String[] {"-q", "--hvdd", "A + B", "-o", dir.toString()}));
    Assertions.assertEquals(1, MTNCLGenCmd.run(new String[] {"-q", "-e", "A", "--hvdd", "A", "--lvdd", "A"}));
    Assertions.assertEquals(1, MTNCLGenCmd.run(new String[] {"-q", "-e", "A & B", "-n", "many"}));
    Assertions.assertEquals(1, MTNCLGenCmd.run(new String[] {"--no-such-option"}));
    Assertions.assertFalse(Files.exists(dir.resolve("circuit_0.v")));
  }
}
