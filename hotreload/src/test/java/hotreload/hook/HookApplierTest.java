package hotreload.hook;

import hotreload.exceptions.HookException;
import hotreload.module.MethodKey;
import hotreload.synth.PatchModule;
import hotreload.synth.PatchNaming;
import hotreload.synth.PatchedMethod;
import hotreload.synth.WrapperKind;
import hotreload.synth.WrapperRef;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.objectweb.asm.Type;

import java.lang.reflect.Method;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("HookApplier")
class HookApplierTest {

    public static class Cart {
        public int total() { return 1; }
        public int count() { return 1; }
    }

    public static class CartPatch1 {
        public static int total(Cart self) { return 2; }
        public static int count(Cart self) { return 2; }
        public static int bonus(Cart self) { return 10; }
    }

    public static class CartPatch2 {
        public static int total(Cart self) { return 3; }
        public static int bonus(Cart self) { return 20; }
    }

    private static final String CART = internalName(Cart.class);
    private static final String PATCH1 = internalName(CartPatch1.class);
    private static final String PATCH2 = internalName(CartPatch2.class);
    private static final String WRAPPER_DESC = "(L" + CART + ";)I";
    private static final Path JAR1 = Path.of("patches/app/app-patch-1.jar");
    private static final Path JAR2 = Path.of("patches/app/app-patch-2.jar");

    private static final MethodKey TOTAL = new MethodKey(CART, "total", "()I");
    private static final MethodKey COUNT = new MethodKey(CART, "count", "()I");
    private static final MethodKey BONUS = new MethodKey(CART, "bonus", "()I");

    private MethodRedirector redirector;
    private PatchLoader loader;
    private HookApplier applier;

    private static String internalName(Class<?> type) {
        return Type.getInternalName(type);
    }

    private static WrapperRef ref(String owner, String name, long sequence, Path jar) {
        return new WrapperRef(owner, name, WRAPPER_DESC, sequence, jar);
    }

    private static PatchModule patch(long sequence, Path jar, List<PatchedMethod> methods) {
        return new PatchModule(new PatchNaming("app", sequence, jar), Map.of(), Map.of(), methods,
                Set.of(), List.of(), List.of(), Set.of());
    }

    private static Method method(Class<?> type, String name, Class<?>... params) throws NoSuchMethodException {
        return type.getDeclaredMethod(name, params);
    }

    @BeforeEach
    void setUp() throws HookException {
        redirector = mock(MethodRedirector.class);
        loader = mock(PatchLoader.class);
        when(redirector.redirect(any(), any())).thenReturn(RedirectResult.ok());
        when(loader.load(JAR1)).thenReturn(new LoadedPatch("app", 1, JAR1, Map.of(PATCH1, CartPatch1.class)));
        when(loader.load(JAR2)).thenReturn(new LoadedPatch("app", 2, JAR2, Map.of(PATCH2, CartPatch2.class)));
        ClassLocator classes = name -> name.equals(Cart.class.getName()) ? Optional.of(Cart.class) : Optional.empty();
        applier = new HookApplier(redirector, loader, classes);
    }

    private PatchModule firstPatch() throws HookException {
        PatchModule patch = patch(1, JAR1, List.of(
                new PatchedMethod(TOTAL, WrapperKind.MODIFIED, ref(PATCH1, "total", 1, JAR1)),
                new PatchedMethod(COUNT, WrapperKind.MODIFIED, ref(PATCH1, "count", 1, JAR1)),
                new PatchedMethod(BONUS, WrapperKind.ADDED, ref(PATCH1, "bonus", 1, JAR1))));
        when(loader.load(patch)).thenReturn(new LoadedPatch("app", 1, JAR1, Map.of(PATCH1, CartPatch1.class)));
        return patch;
    }

    private PatchModule secondPatch() throws HookException {
        PatchModule patch = patch(2, JAR2, List.of(
                new PatchedMethod(TOTAL, WrapperKind.MODIFIED, ref(PATCH2, "total", 2, JAR2)),
                new PatchedMethod(BONUS, WrapperKind.ADDED, ref(PATCH2, "bonus", 2, JAR2))));
        when(loader.load(patch)).thenReturn(new LoadedPatch("app", 2, JAR2, Map.of(PATCH2, CartPatch2.class)));
        return patch;
    }

    @Nested
    @DisplayName("first patch")
    class FirstPatch {

        @Test
        @DisplayName("redirects modified originals and records every method")
        void redirectsModified() throws Exception {
            HookReport report = applier.apply(firstPatch());

            assertThat(report.success()).isTrue();
            assertThat(report.appliedCount()).isEqualTo(3);
            verify(redirector).redirect(method(Cart.class, "total"), method(CartPatch1.class, "total", Cart.class));
            verify(redirector).redirect(method(Cart.class, "count"), method(CartPatch1.class, "count", Cart.class));
            verify(redirector).commit();
            assertThat(applier.record(BONUS)).get()
                    .satisfies(r -> {
                        assertThat(r.kind()).isEqualTo(WrapperKind.ADDED);
                        assertThat(r.history()).isEmpty();
                    });
        }

        @Test
        @DisplayName("never redirects anything for an added method")
        void addedNotRedirected() throws Exception {
            applier.apply(firstPatch());

            verify(redirector, never()).redirect(any(),
                    argThat(m -> m.getName().equals("bonus")));
        }

        @Test
        @DisplayName("reports a failed redirect and keeps hooking the rest")
        void perMethodFailure() throws Exception {
            when(redirector.redirect(method(Cart.class, "total"), method(CartPatch1.class, "total", Cart.class)))
                    .thenReturn(RedirectResult.failed("class redefinition rejected"));

            HookReport report = applier.apply(firstPatch());

            assertThat(report.success()).isFalse();
            assertThat(report.appliedCount()).isEqualTo(2);
            assertThat(report.failures()).singleElement().satisfies(f -> {
                assertThat(f.method()).isEqualTo(TOTAL);
                assertThat(f.status()).isEqualTo(HookResult.Status.REDIRECT_FAILED);
                assertThat(f.reason()).contains("redefinition rejected");
            });
            assertThat(applier.record(TOTAL)).isEmpty();
            assertThat(applier.record(COUNT)).isPresent();
        }

        @Test
        @DisplayName("reports a wrapper missing from the loaded patch")
        void missingWrapper() throws Exception {
            PatchModule patch = patch(1, JAR1, List.of(
                    new PatchedMethod(TOTAL, WrapperKind.MODIFIED, ref(PATCH1, "absent", 1, JAR1))));
            when(loader.load(patch)).thenReturn(new LoadedPatch("app", 1, JAR1, Map.of(PATCH1, CartPatch1.class)));

            HookReport report = applier.apply(patch);

            assertThat(report.failures()).singleElement()
                    .extracting(HookResult::status).isEqualTo(HookResult.Status.MISSING_WRAPPER);
        }

        @Test
        @DisplayName("reports a modified method whose type is not loaded")
        void missingOriginal() throws Exception {
            MethodKey elsewhere = new MethodKey("shop/Gone", "total", "()I");
            PatchModule patch = patch(1, JAR1, List.of(
                    new PatchedMethod(elsewhere, WrapperKind.MODIFIED, ref(PATCH1, "total", 1, JAR1))));
            when(loader.load(patch)).thenReturn(new LoadedPatch("app", 1, JAR1, Map.of(PATCH1, CartPatch1.class)));

            HookReport report = applier.apply(patch);

            assertThat(report.failures()).singleElement()
                    .extracting(HookResult::status).isEqualTo(HookResult.Status.MISSING_ORIGINAL);
        }

        @Test
        @DisplayName("propagates a patch that cannot be loaded at all")
        void loadFailure() throws Exception {
            PatchModule patch = patch(1, JAR1, List.of());
            when(loader.load(patch)).thenThrow(new HookException("cannot define patch classes"));

            assertThatThrownBy(() -> applier.apply(patch)).isInstanceOf(HookException.class);
        }
    }

    @Nested
    @DisplayName("chaining")
    class Chaining {

        @Test
        @DisplayName("redirects earlier wrappers to the newest one")
        void chainsEarlierWrappers() throws Exception {
            applier.apply(firstPatch());

            HookReport report = applier.apply(secondPatch());

            assertThat(report.success()).isTrue();
            InOrder order = inOrder(redirector);
            order.verify(redirector).redirect(method(Cart.class, "total"), method(CartPatch2.class, "total", Cart.class));
            order.verify(redirector).redirect(method(CartPatch1.class, "total", Cart.class),
                    method(CartPatch2.class, "total", Cart.class));
            verify(redirector).redirect(method(CartPatch1.class, "bonus", Cart.class),
                    method(CartPatch2.class, "bonus", Cart.class));

            HookRecord bonus = applier.record(BONUS).orElseThrow();
            assertThat(bonus.current()).isEqualTo(ref(PATCH2, "bonus", 2, JAR2));
            assertThat(bonus.history()).containsExactly(ref(PATCH1, "bonus", 1, JAR1));
        }

        @Test
        @DisplayName("keeps the new wrapper current when an earlier one cannot follow")
        void chainFailure() throws Exception {
            applier.apply(firstPatch());
            when(redirector.redirect(method(CartPatch1.class, "bonus", Cart.class),
                    method(CartPatch2.class, "bonus", Cart.class)))
                    .thenReturn(RedirectResult.failed("no slot"));

            HookReport report = applier.apply(secondPatch());

            assertThat(report.failures()).extracting(HookResult::method).containsExactly(BONUS);
            HookRecord bonus = applier.record(BONUS).orElseThrow();
            assertThat(bonus.current().sequence()).isEqualTo(2);
            assertThat(bonus.lastError()).contains("no slot");
        }
    }

    @Nested
    @DisplayName("records")
    class Records {

        @Test
        @DisplayName("restore re-hooks persisted records through their jars")
        void restore() throws Exception {
            HookRecord total = HookRecord.first("app", TOTAL, WrapperKind.MODIFIED, ref(PATCH1, "total", 1, JAR1))
                    .chain(ref(PATCH2, "total", 2, JAR2));

            HookReport report = applier.apply(HookRecordSnapshot.of(List.of(total)));

            assertThat(report.success()).isTrue();
            verify(loader).load(JAR1);
            verify(loader).load(JAR2);
            verify(redirector).redirect(method(Cart.class, "total"), method(CartPatch2.class, "total", Cart.class));
            assertThat(applier.record(TOTAL)).contains(total);
        }

        @Test
        @DisplayName("snapshot and clear operate per module")
        void snapshotAndClear() throws Exception {
            applier.apply(firstPatch());

            assertThat(applier.snapshot().size()).isEqualTo(3);

            applier.clear("billing");
            assertThat(applier.snapshot().size()).isEqualTo(3);

            applier.clear("app");
            assertThat(applier.snapshot().isEmpty()).isTrue();
        }
    }
}
