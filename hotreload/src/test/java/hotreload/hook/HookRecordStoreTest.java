package hotreload.hook;

import hotreload.module.MethodKey;
import hotreload.synth.WrapperKind;
import hotreload.synth.WrapperRef;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("HookRecordStore")
class HookRecordStoreTest {

    @TempDir
    Path tempDir;

    private static WrapperRef wrapper(long sequence, Path dir) {
        return new WrapperRef("shop/Cart$$HotPatch$" + sequence, "total", "(Lshop/Cart;)I", sequence,
                dir.resolve("patches/app/app-patch-" + sequence + ".jar"));
    }

    @Test
    @DisplayName("round-trips records with history and errors")
    void roundTrip() throws IOException {
        MethodKey total = new MethodKey("shop/Cart", "total", "()I");
        MethodKey extra = new MethodKey("shop/Cart", "extra", "(Ljava/lang/String;)V");
        HookRecord modified = HookRecord.first("app", total, WrapperKind.MODIFIED, wrapper(1, tempDir))
                .chain(wrapper(2, tempDir))
                .chain(wrapper(3, tempDir));
        HookRecord added = HookRecord.first("app", extra, WrapperKind.ADDED, wrapper(2, tempDir))
                .withError("earlier wrapper is not defined");
        HookRecordStore store = new HookRecordStore(tempDir.resolve("work"));

        store.save(HookRecordSnapshot.of(List.of(modified, added)));
        HookRecordSnapshot loaded = store.load();

        assertThat(store.exists()).isTrue();
        assertThat(loaded.size()).isEqualTo(2);
        assertThat(loaded.records().get(total.fullName())).isEqualTo(modified);
        assertThat(loaded.records().get(extra.fullName())).isEqualTo(added);
        assertThat(loaded.forModule("app")).hasSize(2);
        assertThat(loaded.forModule("billing")).isEmpty();
    }

    @Test
    @DisplayName("loads an empty snapshot when nothing was saved")
    void missingFile() throws IOException {
        HookRecordStore store = new HookRecordStore(tempDir);

        assertThat(store.exists()).isFalse();
        assertThat(store.load().isEmpty()).isTrue();
    }

    @Test
    @DisplayName("overwrites earlier records without leaving a temp file")
    void overwrite() throws IOException {
        HookRecordStore store = new HookRecordStore(tempDir);
        MethodKey total = new MethodKey("shop/Cart", "total", "()I");
        store.save(HookRecordSnapshot.of(List.of(HookRecord.first("app", total, WrapperKind.MODIFIED,
                wrapper(1, tempDir)))));

        store.save(HookRecordSnapshot.empty());

        assertThat(store.load().isEmpty()).isTrue();
        assertThat(tempDir.resolve(HookRecordStore.FILE_NAME + ".tmp")).doesNotExist();
    }

    @Test
    @DisplayName("reports malformed files as I/O errors")
    void malformed() throws IOException {
        HookRecordStore store = new HookRecordStore(tempDir);
        Files.writeString(store.file(), """
                "shop/Cart::total()I":
                  module: app
                  kind: SIDEWAYS
                """);

        assertThatThrownBy(store::load).isInstanceOf(IOException.class).hasMessageContaining("Malformed");
    }

    @Test
    @DisplayName("rejects a document that is not a mapping")
    void notAMapping() throws IOException {
        HookRecordStore store = new HookRecordStore(tempDir);
        Files.writeString(store.file(), "- just\n- a list\n");

        assertThatThrownBy(store::load).isInstanceOf(IOException.class);
    }

    @Test
    @DisplayName("delete removes the file")
    void delete() throws IOException {
        HookRecordStore store = new HookRecordStore(tempDir);
        store.save(HookRecordSnapshot.empty());

        store.delete();

        assertThat(store.exists()).isFalse();
    }
}
