//
// Yinx - renders YANG schema models as YIN
// See LICENSE in the project root for terms

package yinx.yin;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import org.junit.*;
import yinx.expr.ExprTranslator;
import yinx.model.*;
import yinx.model.Module;
import static org.junit.Assert.*;
import static yinx.yin.StmtPrinterTest.lines;

public class YinPrinterTest {

  @Test public void simpleModule () throws PrintException {
    Module m = Module.module("m", "urn:m", "m");
    Type.StringType str = new Type.StringType();
    str.length = new Restriction("1..10");
    LeafNode x = m.add(new LeafNode(m, "x", str));
    x.description = "d";

    assertEquals(lines(
      "<?xml version=\"1.0\" encoding=\"UTF-8\"?>",
      "<module name=\"m\"",
      "        xmlns=\"urn:ietf:params:xml:ns:yang:yin:1\"",
      "        xmlns:m=\"urn:m\">",
      "  <namespace uri=\"urn:m\"/>",
      "  <prefix value=\"m\"/>",
      "  <leaf name=\"x\">",
      "    <type name=\"string\">",
      "      <length value=\"1..10\"/>",
      "    </type>",
      "    <description>",
      "      <text>d</text>",
      "    </description>",
      "  </leaf>",
      "</module>"), new YinPrinter().print(m));
  }

  @Test public void moduleHeader () throws PrintException {
    Module m = Module.module("m", "urn:m", "m");
    m.version = YangVersion.V1;
    m.deviated = true;
    Import types = m.addImport(Module.module("types", "urn:types", "ty"), "t");
    types.revision = "2020-01-01";
    m.addImport(Module.module("hidden", "urn:hidden", "h"), "h").external = true;
    Module partA = Module.submodule("m-a", m, "m");
    Module partB = Module.submodule("m-b", m, "m");
    m.addInclude(partA);
    m.addInclude(partB).revision = "2022-01-01";
    m.organization = "Example & Co";
    m.contact = "ops@example.com";
    m.description = "Main";
    Revision initial = new Revision("2021-02-03");
    initial.description = "Initial";
    m.revisions.add(initial);
    m.revisions.add(new Revision("2020-06-01"));
    // contributed by a submodule and printed with it
    m.add(new ContainerNode(partA, "from-a"));

    assertEquals(lines(
      "<?xml version=\"1.0\" encoding=\"UTF-8\"?>",
      "<!-- DEVIATED -->",
      "<module name=\"m\"",
      "        xmlns=\"urn:ietf:params:xml:ns:yang:yin:1\"",
      "        xmlns:m=\"urn:m\"",
      "        xmlns:t=\"urn:types\">",
      "  <yang-version value=\"1\"/>",
      "  <namespace uri=\"urn:m\"/>",
      "  <prefix value=\"m\"/>",
      "  <import module=\"types\">",
      "    <prefix value=\"t\"/>",
      "    <revision-date date=\"2020-01-01\"/>",
      "  </import>",
      "  <include module=\"m-a\"/>",
      "  <include module=\"m-b\">",
      "    <revision-date date=\"2022-01-01\"/>",
      "  </include>",
      "  <organization>",
      "    <text>Example &amp; Co</text>",
      "  </organization>",
      "  <contact>",
      "    <text>ops@example.com</text>",
      "  </contact>",
      "  <description>",
      "    <text>Main</text>",
      "  </description>",
      "  <revision date=\"2021-02-03\">",
      "    <description>",
      "      <text>Initial</text>",
      "    </description>",
      "  </revision>",
      "  <revision date=\"2020-06-01\"/>",
      "</module>"), new YinPrinter().print(m));
  }

  @Test public void submoduleHeader () throws PrintException {
    Module m = Module.module("m", "urn:m", "m");
    m.version = YangVersion.V1_1;
    Module part = Module.submodule("m-part", m, "mp");
    part.version = YangVersion.V1;
    part.addImport(Module.module("types", "urn:types", "ty"), "t");
    part.add(new LeafNode(part, "flag", new Type.Simple(BaseType.BOOLEAN)));

    assertEquals(lines(
      "<?xml version=\"1.0\" encoding=\"UTF-8\"?>",
      "<submodule name=\"m-part\"",
      "           xmlns=\"urn:ietf:params:xml:ns:yang:yin:1\"",
      "           xmlns:t=\"urn:types\">",
      "  <yang-version value=\"1.1\"/>",
      "  <belongs-to module=\"m\">",
      "    <prefix value=\"mp\"/>",
      "  </belongs-to>",
      "  <import module=\"types\">",
      "    <prefix value=\"t\"/>",
      "  </import>",
      "  <leaf name=\"flag\">",
      "    <type name=\"boolean\"/>",
      "  </leaf>",
      "</submodule>"), new YinPrinter().print(part));
  }

  @Test public void bodyOrder () throws PrintException {
    Module m = Module.module("m", "urn:m", "m");
    Module target = Module.module("target", "urn:target", "tg");
    m.addImport(target, "t");
    ContainerNode sys = target.add(new ContainerNode(target, "system"));

    Augment aug = new Augment(m, "/target:system", sys);
    aug.add(new LeafNode(m, "hostname", new Type.StringType()));
    m.augments.add(aug);
    m.add(new NotificationNode(m, "restarted"));
    m.add(new ContainerNode(m, "config"));
    Deviation dev = new Deviation("/target:system");
    dev.add(Deviation.Op.NOT_SUPPORTED);
    m.deviations.add(dev);
    m.typedefs.add(new Typedef(m, "host", new Type.StringType()));
    m.identities.add(new Identity(m, "role"));
    m.features.add(new Feature(m, "extras"));

    String doc = new YinPrinter().print(m);
    String[] order = { "<feature ", "<identity ", "<typedef ", "<deviation ",
                       "<notification ", "<container ", "<augment " };
    int last = -1;
    for (String elem : order) {
      int idx = doc.indexOf(elem);
      assertTrue(elem + " missing or out of order", idx > last);
      last = idx;
    }
    // printed once, under its augment
    assertEquals(doc.indexOf("<leaf name=\"hostname\">"),
                 doc.lastIndexOf("<leaf name=\"hostname\">"));
    assertTrue(doc.indexOf("<leaf name=\"hostname\">") > doc.indexOf("<augment "));
    assertTrue(doc.contains("<augment target-node=\"/tg:system\">"));
  }

  @Test public void ownAugmentPrintedOnce () throws PrintException {
    Module m = Module.module("m", "urn:m", "m");
    ContainerNode c = m.add(new ContainerNode(m, "c"));
    Augment aug = new Augment(m, "/m:c", c);
    m.augments.add(aug);
    aug.add(new LeafNode(m, "x", new Type.StringType()));

    String doc = new YinPrinter().print(m);
    int first = doc.indexOf("<leaf name=\"x\">");
    assertTrue(first > doc.indexOf("<augment target-node=\"/m:c\">"));
    assertEquals(first, doc.lastIndexOf("<leaf name=\"x\">"));
  }

  @Test public void balancedTags () throws PrintException {
    Module m = Module.module("m", "urn:m", "m");
    m.addImport(Module.module(NacmDefault.MODULE, "urn:acm", "nacm"), "nacm");
    GroupingNode grp = m.add(new GroupingNode(m, "addr"));
    grp.add(new LeafNode(m, "ip", new Type.StringType()));
    ContainerNode top = m.add(new ContainerNode(m, "top"));
    top.nacm.add(NacmDefault.DENY_ALL);
    ListNode list = top.add(new ListNode(m, "server"));
    list.keys.add(list.add(new LeafNode(m, "name", new Type.StringType())));
    list.add(new UsesNode(m, grp)).refines.add(new Refine("ip", Node.Kind.LEAF));
    ChoiceNode choice = list.add(new ChoiceNode(m, "mode"));
    choice.add(new CaseNode(m, "fast")).add(new AnyxmlNode(m, "opts")).mandatory = true;
    Type.Bits flags = new Type.Bits();
    flags.add("a", 0).description = "first";
    Type.Numeric count = new Type.Numeric(BaseType.INT16);
    count.range = new Restriction("0..9");
    list.add(new LeafListNode(m, "flags", new Type.Union(flags, count)));
    RpcNode rpc = m.add(new RpcNode(m, "ping"));
    rpc.add(InOutNode.output(m)).add(new LeafNode(m, "ms", new Type.Decimal64(3)));

    String doc = new YinPrinter().print(m);
    Deque<String> open = new ArrayDeque<>();
    for (String line : doc.split("\n")) {
      String tag = line.trim();
      if (tag.startsWith("<?") || tag.startsWith("<!--")) continue;
      // root start tag spans several lines
      if (tag.startsWith("xmlns")) continue;
      if (tag.startsWith("</")) {
        assertEquals(open.pop(), tag.substring(2, tag.length()-1));
      } else if (!tag.endsWith("/>") && !tag.contains("</")) {
        int end = tag.indexOf(' ');
        open.push(tag.substring(1, end > 0 ? end : tag.length()-1));
      }
    }
    assertTrue("Unclosed: " + open, open.isEmpty());
    assertTrue(doc.endsWith("</module>\n"));
  }

  @Test public void printToSinks () throws PrintException, IOException {
    Module m = Module.module("m", "urn:m", "m");
    m.description = "Größe";
    YinPrinter printer = new YinPrinter();
    String doc = printer.print(m);

    StringBuilder sb = new StringBuilder();
    printer.print(m, sb);
    assertEquals(doc, sb.toString());

    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    printer.print(m, bytes);
    assertArrayEquals(doc.getBytes(StandardCharsets.UTF_8), bytes.toByteArray());
  }

  @Test public void failedPrintLeavesSinkEmpty () throws IOException {
    Module m = Module.module("m", "urn:m", "m");
    m.add(new ContainerNode(m, "before"));
    LeafNode leaf = m.add(new LeafNode(m, "x", new Type.StringType()));
    leaf.when = new When("/unknown:flag");

    StringBuilder sb = new StringBuilder();
    try {
      new YinPrinter().print(m, sb);
      fail("Expected untranslatable condition to fail");
    } catch (PrintException pe) {
      assertTrue(pe.getMessage().contains("/unknown:flag"));
      assertTrue(pe.getCause() != null);
    }
    assertEquals(0, sb.length());
  }

  @Test public void customTranslator () throws PrintException {
    ExprTranslator upper = new ExprTranslator() {
      @Override public String toSchema (Module module, String expr) {
        return expr.toUpperCase();
      }
      @Override public String toXmlPath (Module module, String path) {
        return path;
      }
    };
    Module m = Module.module("m", "urn:m", "m");
    m.add(new LeafNode(m, "x", new Type.StringType())).when = new When("../y");
    String doc = new YinPrinter().translator(upper).print(m);
    assertTrue(doc.contains("<when condition=\"../Y\"/>"));
  }

  @Test public void depthCeiling () throws PrintException {
    Module m = Module.module("m", "urn:m", "m");
    Node node = m.add(new ContainerNode(m, "c0"));
    for (int ii = 1; ii < 5; ii++) node = node.add(new ContainerNode(m, "c" + ii));

    YinPrinter printer = new YinPrinter();
    assertEquals(YinPrinter.DEFAULT_MAX_DEPTH, printer.maxDepth());
    assertTrue(printer.print(m).contains("<container name=\"c4\">"));
    try {
      printer.maxDepth(4).print(m);
      fail("Expected depth ceiling to be exceeded");
    } catch (PrintException pe) {
      assertTrue(pe.getMessage().contains("c4"));
    }
  }

  @Test(expected=IllegalArgumentException.class)
  public void invalidMaxDepth () {
    new YinPrinter().maxDepth(0);
  }
}
