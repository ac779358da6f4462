package hotreload.diff;

import hotreload.module.CompiledModule;
import hotreload.module.MethodKey;
import hotreload.testing.SourceTree;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.objectweb.asm.tree.MethodNode;

import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CallGraphIndexTest {

    private static final MethodKey FIRST = new MethodKey("lib/Lists", "first", "(Ljava/util/List;)Ljava/lang/Object;");
    private static final MethodKey SIZE = new MethodKey("lib/Lists", "size", "(Ljava/util/List;)I");
    private static final MethodKey HEAD = new MethodKey("lib/Report", "head", "()Ljava/lang/String;");
    private static final MethodKey COUNT = new MethodKey("lib/Report", "count", "()I");

    @TempDir
    Path tempDir;

    private SourceTree tree;
    private CallGraphIndex index;

    @BeforeEach
    void setUp() throws Exception {
        tree = new SourceTree(tempDir, "lib");
        tree.write("lib/Lists.java", """
                package lib;
                import java.util.List;
                public class Lists {
                    public static <T> T first(List<T> list) { return list.get(0); }
                    public static int size(List<?> list) { return list.size(); }
                }
                """);
        tree.write("lib/Report.java", """
                package lib;
                import java.util.List;
                public class Report {
                    public String head() { return Lists.first(List.of("x")); }
                    public int count() { return Lists.size(List.of()); }
                }
                """);
        index = new CallGraphIndex();
        index.index(tree.compile());
    }

    @Test
    void recordsCallersOfGenericMethodsOnly() {
        assertThat(index.isGeneric(FIRST)).isTrue();
        assertThat(index.isGeneric(SIZE)).isFalse();
        assertThat(index.callersOf(FIRST)).containsOnlyKeys(HEAD);
        assertThat(index.callersOf(SIZE)).isEmpty();
        assertThat(index.calleesOf(HEAD)).containsExactly(FIRST);
    }

    @Test
    void callerBodyIsTheIndexedOne() {
        MethodNode body = index.callersOf(FIRST).get(HEAD);

        assertThat(body.name).isEqualTo("head");
    }

    @Test
    void updateReplacesEdgesOfChangedBodies() throws Exception {
        tree.write("lib/Report.java", """
                package lib;
                import java.util.List;
                public class Report {
                    public String head() { return "fixed"; }
                    public int count() { return Lists.first(List.of(1)); }
                }
                """);
        CompiledModule changed = tree.compile();

        index.update(Map.of(
                HEAD, changed.method(HEAD),
                COUNT, changed.method(COUNT)));

        assertThat(index.callersOf(FIRST)).containsOnlyKeys(COUNT);
        assertThat(index.calleesOf(HEAD)).isEmpty();
    }

    @Test
    void updateTracksMethodsBecomingGeneric() throws Exception {
        tree.write("lib/Lists.java", """
                package lib;
                import java.util.List;
                public class Lists {
                    public static <T> T first(List<T> list) { return list.get(0); }
                    public static <T> int size(List<T> list) { return list.size(); }
                }
                """);
        CompiledModule changed = tree.compile();

        index.update(Map.of(SIZE, changed.method(SIZE)));

        assertThat(index.isGeneric(SIZE)).isTrue();
        assertThat(index.callersOf(SIZE)).containsOnlyKeys(COUNT);
        assertThat(index.calleesOf(COUNT)).containsExactly(SIZE);
    }

    @Test
    void keysInheritedGenericsByDeclaringType() throws Exception {
        tree.write("lib/Base.java", """
                package lib;
                public class Base {
                    public <T> T pick(T first, T second) { return first; }
                }
                """);
        tree.write("lib/Sub.java", """
                package lib;
                public class Sub extends Base {
                }
                """);
        tree.write("lib/Till.java", """
                package lib;
                public class Till {
                    public String ring() { return new Sub().pick("a", "b"); }
                }
                """);
        index.index(tree.compile());

        MethodKey pick = new MethodKey("lib/Base", "pick",
                "(Ljava/lang/Object;Ljava/lang/Object;)Ljava/lang/Object;");
        MethodKey ring = new MethodKey("lib/Till", "ring", "()Ljava/lang/String;");
        assertThat(index.callersOf(pick)).containsOnlyKeys(ring);
        assertThat(index.calleesOf(ring)).containsExactly(pick);
    }

    @Test
    void keysDefaultMethodsByDeclaringInterface() throws Exception {
        tree.write("lib/Picker.java", """
                package lib;
                public interface Picker {
                    default <T> T pick(T first, T second) { return second; }
                }
                """);
        tree.write("lib/Hand.java", """
                package lib;
                public class Hand implements Picker {
                    public String choose() { return pick("a", "b"); }
                }
                """);
        index.index(tree.compile());

        MethodKey pick = new MethodKey("lib/Picker", "pick",
                "(Ljava/lang/Object;Ljava/lang/Object;)Ljava/lang/Object;");
        assertThat(index.callersOf(pick))
                .containsOnlyKeys(new MethodKey("lib/Hand", "choose", "()Ljava/lang/String;"));
    }

    @Test
    void clearForgetsEverything() {
        index.clear();

        assertThat(index.callersOf(FIRST)).isEmpty();
        assertThat(index.isGeneric(FIRST)).isFalse();
    }
}
