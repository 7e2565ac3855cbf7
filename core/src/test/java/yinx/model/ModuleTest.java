//
// Yinx - renders YANG schema models as YIN
// See LICENSE in the project root for terms

package yinx.model;

import java.util.EnumSet;
import java.util.Optional;
import org.junit.*;
import static org.junit.Assert.*;

public class ModuleTest {

  @Test public void prefixLookups () {
    Module acm = Module.module("ietf-netconf-acm", "urn:acm", "nacm");
    Module types = Module.module("types", "urn:types", "t");
    Module main = Module.module("main", "urn:main", "mn");
    Module sub = Module.submodule("main-sub", main, "mn");
    sub.addImport(acm, "ac");
    main.addImport(types, "tt");
    main.addInclude(sub);

    assertEquals(Optional.of("tt"), main.importPrefix("types"));
    assertEquals(Optional.empty(), main.importPrefix("ietf-netconf-acm"));
    assertEquals(Optional.of("mn"), main.prefixFor("main"));
    assertEquals(Optional.of("tt"), main.prefixFor("types"));
    // reached only through the include
    assertEquals(Optional.of("ac"), main.prefixFor("ietf-netconf-acm"));
    assertEquals(Optional.empty(), main.prefixFor("nowhere"));

    assertSame(main, sub.mainModule());
    assertSame(main, sub.visibleModule("main").get());
    assertSame(acm, sub.visibleModule("ietf-netconf-acm").get());
    assertFalse(sub.visibleModule("types").isPresent());
  }

  @Test(expected=IllegalArgumentException.class)
  public void includeForeignSubmodule () {
    Module one = Module.module("one", "urn:one", "o");
    Module two = Module.module("two", "urn:two", "t");
    one.addInclude(Module.submodule("two-sub", two, "t"));
  }

  @Test(expected=IllegalArgumentException.class)
  public void importSubmodule () {
    Module one = Module.module("one", "urn:one", "o");
    Module two = Module.module("two", "urn:two", "t");
    one.addImport(Module.submodule("two-sub", two, "t"), "ts");
  }

  @Test public void effectiveConfig () {
    Module m = Module.module("m", "urn:m", "m");
    ContainerNode top = m.add(new ContainerNode(m, "top"));
    ContainerNode state = top.add(new ContainerNode(m, "state"));
    LeafNode leaf = state.add(new LeafNode(m, "counter", new Type.Simple(BaseType.EMPTY)));
    assertTrue(top.effectiveConfig());
    assertTrue(leaf.effectiveConfig());

    state.config = false;
    assertTrue(top.effectiveConfig());
    assertFalse(state.effectiveConfig());
    assertFalse(leaf.effectiveConfig());
  }

  @Test public void effectiveNacm () {
    Module m = Module.module("m", "urn:m", "m");
    ContainerNode top = m.add(new ContainerNode(m, "top"));
    ListNode list = top.add(new ListNode(m, "entry"));
    top.nacm.add(NacmDefault.DENY_WRITE);
    list.nacm.add(NacmDefault.DENY_WRITE);
    list.nacm.add(NacmDefault.DENY_ALL);

    assertEquals(EnumSet.of(NacmDefault.DENY_WRITE), top.introducedNacm());
    assertEquals(EnumSet.of(NacmDefault.DENY_ALL), list.introducedNacm());
    assertEquals(EnumSet.allOf(NacmDefault.class), list.effectiveNacm());
  }

  @Test public void augmentAttachesToTarget () {
    Module base = Module.module("base", "urn:base", "b");
    Module ext = Module.module("ext", "urn:ext", "e");
    ContainerNode top = base.add(new ContainerNode(base, "top"));
    top.config = false;

    Augment aug = new Augment(ext, "/base:top", top);
    ext.augments.add(aug);
    LeafNode extra = aug.add(new LeafNode(ext, "extra", new Type.StringType()));

    assertSame(top, extra.parent());
    assertEquals(1, top.children().size());
    assertEquals(1, aug.children().size());
    // inherited through the target
    assertFalse(extra.effectiveConfig());
  }

  @Test public void augmentNacm () {
    Module base = Module.module("base", "urn:base", "b");
    Module ext = Module.module("ext", "urn:ext", "e");
    ContainerNode top = base.add(new ContainerNode(base, "top"));
    top.nacm.add(NacmDefault.DENY_WRITE);

    Augment aug = new Augment(ext, "/base:top", top);
    aug.nacm.add(NacmDefault.DENY_ALL);
    ContainerNode extra = aug.add(new ContainerNode(ext, "extra"));
    extra.nacm.add(NacmDefault.DENY_ALL);
    LeafNode leaf = extra.add(new LeafNode(ext, "secret", new Type.StringType()));

    assertSame(aug, extra.augment());
    assertNull(leaf.augment());
    assertTrue(extra.introducedNacm().isEmpty());
    assertEquals(EnumSet.allOf(NacmDefault.class), leaf.effectiveNacm());
    assertTrue(leaf.introducedNacm().isEmpty());
  }

  @Test(expected=IllegalStateException.class)
  public void injectTwice () {
    Module m = Module.module("m", "urn:m", "m");
    LeafNode leaf = new LeafNode(m, "x", new Type.StringType());
    new Augment(m, "/m:a", null).add(leaf);
    new Augment(m, "/m:b", null).add(leaf);
  }

  @Test(expected=IllegalArgumentException.class)
  public void augmentForeignChild () {
    Module base = Module.module("base", "urn:base", "b");
    Module ext = Module.module("ext", "urn:ext", "e");
    Augment aug = new Augment(ext, "/base:top", null);
    aug.add(new LeafNode(base, "extra", new Type.StringType()));
  }

  @Test public void addTwice () {
    Module m = Module.module("m", "urn:m", "m");
    ContainerNode one = m.add(new ContainerNode(m, "one"));
    ContainerNode two = m.add(new ContainerNode(m, "two"));
    LeafNode leaf = one.add(new LeafNode(m, "x", new Type.StringType()));
    try {
      two.add(leaf);
      fail("Expected adding a parented node to fail");
    } catch (IllegalStateException ise) {
      // expected
    }
    try {
      m.add(leaf);
      fail("Expected adding a nested node at the top level to fail");
    } catch (IllegalStateException ise) {
      // expected
    }
    assertEquals(0, two.children().size());
  }

  @Test public void derivedTypes () {
    Module m = Module.module("m", "urn:m", "m");
    Typedef pct = new Typedef(m, "percent", new Type.Numeric(BaseType.UINT8));
    Type type = new Type.Numeric(BaseType.UINT8).derivedFrom(pct);
    assertEquals("percent", type.name());
    assertEquals("uint8", new Type.Numeric(BaseType.UINT8).name());
    try {
      new Type.StringType().derivedFrom(pct);
      fail("Expected base type mismatch to fail");
    } catch (IllegalArgumentException iae) {
      // expected
    }
  }
}
