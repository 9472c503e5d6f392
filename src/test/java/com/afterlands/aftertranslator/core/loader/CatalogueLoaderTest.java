package com.afterlands.aftertranslator.core.loader;

import com.afterlands.aftertranslator.api.model.Locale;
import com.afterlands.aftertranslator.core.catalogue.Catalogue;
import com.afterlands.aftertranslator.core.catalogue.CatalogueBag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CatalogueLoaderTest {

    private static final Logger LOGGER = Logger.getLogger(CatalogueLoaderTest.class.getName());

    @TempDir
    Path dir;

    private final CatalogueLoader loader = new CatalogueLoader(LOGGER);

    private void write(String name, String content) throws IOException {
        Files.writeString(dir.resolve(name), content, StandardCharsets.UTF_8);
    }

    @Test
    void loadsYamlAndJsonFiles() throws Exception {
        write("messages.en.yml", String.join("\n",
                "greeting: \"Hello, {name}!\"",
                "menu:",
                "  title: Main menu",
                "motd:",
                "  - Line one",
                "  - Line two",
                "404: Not found",
                ""));
        write("messages.fr.json", "{\"greeting\": \"Bonjour, {name} !\", \"menu\": {\"title\": \"Menu principal\"}}");

        CatalogueBag bag = loader.load(dir);

        Catalogue en = bag.get(Locale.ENGLISH).orElseThrow();
        assertThat(en.get("messages", "greeting")).contains("Hello, {name}!");
        assertThat(en.get("messages", "menu.title")).contains("Main menu");
        assertThat(en.get("messages", "motd")).contains("Line one\nLine two");
        assertThat(en.get("messages", "404")).contains("Not found");

        Catalogue fr = bag.get(Locale.FRENCH).orElseThrow();
        assertThat(fr.get("messages", "menu.title")).contains("Menu principal");
    }

    @Test
    void mergesFilesOfSameLocaleInNameOrder() throws Exception {
        write("errors.en_US.yaml", "oops: Oops");
        write("messages.en_US.json", "{\"a\": \"from json\", \"b\": \"only json\"}");
        write("messages.en_US.yml", "a: from yaml");

        CatalogueBag bag = loader.load(dir);
        Catalogue catalogue = bag.get(Locale.ENGLISH_UNITED_STATES).orElseThrow();

        assertThat(bag.size()).isEqualTo(1);
        assertThat(catalogue.domains()).containsExactly("errors", "messages");
        assertThat(catalogue.get("messages", "a")).contains("from yaml");
        assertThat(catalogue.get("messages", "b")).contains("only json");
    }

    @Test
    void domainMayContainDots() throws Exception {
        write("app.errors.pt-BR.yml", "oops: Ops");

        Catalogue catalogue = loader.load(dir).get(Locale.PORTUGUESE_BRAZIL).orElseThrow();

        assertThat(catalogue.get("app.errors", "oops")).contains("Ops");
    }

    @Test
    void ignoresOtherFilesAndSubdirectories() throws Exception {
        write("README.txt", "not a catalogue");
        write("messages.en.toml", "a = \"b\"");
        Files.createDirectory(dir.resolve("nested.en.yml"));

        assertThat(loader.load(dir).isEmpty()).isTrue();
    }

    @Test
    void rejectsFileNameWithoutLocale() throws Exception {
        write("messages.yml", "a: b");

        assertThatThrownBy(() -> loader.load(dir))
                .isInstanceOf(CatalogueLoadException.class)
                .hasMessageContaining("expected {domain}.{locale}.{ext} for 'messages.yml'")
                .satisfies(e -> assertThat(((CatalogueLoadException) e).getKind())
                        .isEqualTo(CatalogueLoadException.Kind.INVALID_FILENAME_FORMAT));
    }

    @Test
    void rejectsUnknownLocaleInFileName() throws Exception {
        write("messages.xx.yml", "a: b");

        assertThatThrownBy(() -> loader.load(dir))
                .isInstanceOf(CatalogueLoadException.class)
                .hasMessageContaining("'xx' in 'messages.xx.yml'")
                .satisfies(e -> assertThat(((CatalogueLoadException) e).getKind())
                        .isEqualTo(CatalogueLoadException.Kind.INVALID_FILENAME_LOCALE));
    }

    @Test
    void rejectsNonStringMessages() throws Exception {
        write("messages.en.yml", "foo:\n  - 1\n  - 2\n");

        assertThatThrownBy(() -> loader.load(dir))
                .isInstanceOf(CatalogueLoadException.class)
                .hasMessageContaining("expected a string for key 'foo'")
                .satisfies(e -> assertThat(((CatalogueLoadException) e).getKind())
                        .isEqualTo(CatalogueLoadException.Kind.INVALID_CONTENT));
    }

    @Test
    void rejectsUnparsableContent() throws Exception {
        write("messages.en.json", "{\"a\": ");

        assertThatThrownBy(() -> loader.load(dir))
                .isInstanceOf(CatalogueLoadException.class)
                .satisfies(e -> assertThat(((CatalogueLoadException) e).getKind())
                        .isEqualTo(CatalogueLoadException.Kind.INVALID_CONTENT));
    }

    @Test
    void rejectsMissingDirectory() {
        Path missing = dir.resolve("missing");

        assertThatThrownBy(() -> loader.load(missing))
                .isInstanceOf(CatalogueLoadException.class)
                .satisfies(e -> {
                    CatalogueLoadException error = (CatalogueLoadException) e;
                    assertThat(error.getKind()).isEqualTo(CatalogueLoadException.Kind.UNREADABLE_DIRECTORY);
                    assertThat(error.getPath()).isEqualTo(missing);
                });
    }

    @Test
    void emptyFileYieldsEmptyCatalogue() throws Exception {
        write("messages.de.yml", "");

        CatalogueBag bag = loader.load(dir);

        assertThat(bag.get(Locale.GERMAN).orElseThrow().isEmpty()).isTrue();
    }

    @Test
    void onlyEnabledFormatsAreScanned() throws Exception {
        write("messages.en.yml", "a: yaml");
        write("messages.fr.json", "{\"a\": \"json\"}");

        CatalogueLoader jsonOnly = new CatalogueLoader(List.of(new JsonCatalogueFormat()), LOGGER, true);
        CatalogueBag bag = jsonOnly.load(dir);

        assertThat(bag.locales()).containsExactly(Locale.FRENCH);
    }

    @Test
    void loadsAsynchronously() throws Exception {
        write("messages.en.yml", "a: b");

        CompletableFuture<CatalogueBag> future = loader.loadAsync(dir, Runnable::run);

        assertThat(future.join().get(Locale.ENGLISH)).isPresent();
    }

    @Test
    void asyncFailureCompletesExceptionally() {
        CompletableFuture<CatalogueBag> future = loader.loadAsync(dir.resolve("missing"), Runnable::run);

        assertThatThrownBy(future::join)
                .isInstanceOf(CompletionException.class)
                .hasCauseInstanceOf(CatalogueLoadException.class);
    }

    @Test
    void parsesFileNames() throws CatalogueLoadException {
        CatalogueFileName name = CatalogueFileName.parse(Path.of("messages.zh_TW.json"));

        assertThat(name.domain()).isEqualTo("messages");
        assertThat(name.locale()).isEqualTo(Locale.CHINESE_TAIWAN);
        assertThat(name.extension()).isEqualTo("json");

        assertThatThrownBy(() -> CatalogueFileName.parse(Path.of(".en.yml")))
                .isInstanceOf(CatalogueLoadException.class);
        assertThatThrownBy(() -> CatalogueFileName.parse(Path.of("messages..yml")))
                .isInstanceOf(CatalogueLoadException.class);
    }

    @Test
    void resolvesFormatsByName() {
        assertThat(CatalogueLoader.formatByName("YAML")).get().extracting(CatalogueFormat::name).isEqualTo("yaml");
        assertThat(CatalogueLoader.formatByName("json")).get().extracting(CatalogueFormat::name).isEqualTo("json");
        assertThat(CatalogueLoader.formatByName("xml")).isEmpty();
    }

    @Test
    void yesNoWordsStayText() throws Exception {
        write("messages.en.yml", String.join("\n",
                "confirm: Yes",
                "deny: no",
                "toggle: off",
                "no: Norwegian",
                ""));

        Catalogue en = loader.load(dir).get(Locale.ENGLISH).orElseThrow();

        assertThat(en.get("messages", "confirm")).contains("Yes");
        assertThat(en.get("messages", "deny")).contains("no");
        assertThat(en.get("messages", "toggle")).contains("off");
        assertThat(en.get("messages", "no")).contains("Norwegian");
        assertThat(en.get("messages", "false")).isEmpty();
    }
}
