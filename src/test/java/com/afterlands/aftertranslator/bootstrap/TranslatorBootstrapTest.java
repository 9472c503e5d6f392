package com.afterlands.aftertranslator.bootstrap;

import com.afterlands.aftertranslator.api.model.Context;
import com.afterlands.aftertranslator.api.model.Locale;
import com.afterlands.aftertranslator.api.service.Translator;
import com.afterlands.aftertranslator.core.loader.CatalogueLoadException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TranslatorBootstrapTest {

    private static final Logger LOGGER = Logger.getLogger(TranslatorBootstrapTest.class.getName());

    @TempDir
    Path dir;

    private Path writeFixtures(String settings) throws IOException {
        Path lang = Files.createDirectories(dir.resolve("lang"));
        Files.writeString(lang.resolve("messages.en.yml"), String.join("\n",
                "greeting: \"Hello, {name}!\"",
                "apples: \"{0} no apples | {1} one apple | {?} apples\""), StandardCharsets.UTF_8);
        Files.writeString(lang.resolve("messages.fr.json"), "{\"greeting\": \"Bonjour, {name} !\"}",
                StandardCharsets.UTF_8);

        Path settingsFile = dir.resolve("translator.yml");
        Files.writeString(settingsFile, settings, StandardCharsets.UTF_8);
        return settingsFile;
    }

    @Test
    void buildsTranslatorFromSettingsFile() throws Exception {
        Path settingsFile = writeFixtures("fallback-locale: en\ncatalogues:\n  directory: lang\n");

        TranslatorBootstrap bootstrap = TranslatorBootstrap.fromFile(settingsFile, LOGGER);
        Translator translator = bootstrap.getTranslator();

        assertThat(translator.translate(Locale.FRENCH_CANADA, "messages", "greeting", Context.of("name", "Zoé")))
                .isEqualTo("Bonjour, Zoé !");
        assertThat(translator.translate(Locale.CHINESE, "messages", "greeting", Context.of("name", "世界")))
                .isEqualTo("Hello, 世界!");
        assertThat(translator.translate(Locale.ENGLISH, "messages", "apples", Context.ofCount(1)))
                .isEqualTo("one apple");
        assertThat(translator.getFallbackLocale()).isEqualTo(Locale.ENGLISH);
    }

    @Test
    void negotiatorOffersLoadedLocales() throws Exception {
        Path settingsFile = writeFixtures("catalogues:\n  directory: lang\n");

        TranslatorBootstrap bootstrap = TranslatorBootstrap.fromFile(settingsFile, LOGGER);

        assertThat(bootstrap.getNegotiator().negotiate("fr-CA, en;q=0.5")).isEqualTo(Locale.FRENCH);
        assertThat(bootstrap.getNegotiator().negotiate("de")).isEqualTo(Locale.ENGLISH);
        assertThat(bootstrap.getNegotiator().getSupported()).containsExactlyInAnyOrder(Locale.ENGLISH, Locale.FRENCH);
    }

    @Test
    void disabledFormatsAreNotLoaded() throws Exception {
        Path settingsFile = writeFixtures("catalogues:\n  directory: lang\n  formats: [yaml]\n");

        Translator translator = TranslatorBootstrap.fromFile(settingsFile, LOGGER).getTranslator();

        assertThat(translator.hasMessage(Locale.ENGLISH, "messages", "greeting")).isTrue();
        assertThat(translator.translate(Locale.FRENCH, "messages", "greeting", Context.of("name", "Zoé")))
                .isEqualTo("Hello, Zoé!");
    }

    @Test
    void unknownFormatIsRejected() throws Exception {
        Path settingsFile = writeFixtures("catalogues:\n  directory: lang\n  formats: [xml]\n");

        assertThatThrownBy(() -> TranslatorBootstrap.fromFile(settingsFile, LOGGER))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("xml");
    }

    @Test
    void missingCatalogueDirectoryFails() throws Exception {
        Path settingsFile = writeFixtures("catalogues:\n  directory: nowhere\n");

        assertThatThrownBy(() -> TranslatorBootstrap.fromFile(settingsFile, LOGGER))
                .isInstanceOf(CatalogueLoadException.class);
    }

    @Test
    void servicesRequireInitialization() throws Exception {
        TranslatorBootstrap bootstrap = new TranslatorBootstrap(TranslatorSettings.defaults(), dir, LOGGER);

        assertThatThrownBy(bootstrap::getTranslator).isInstanceOf(IllegalStateException.class);

        Files.createDirectories(dir.resolve("translations"));
        bootstrap.initialize();

        assertThat(bootstrap.getTemplateCache().getSize()).isZero();
        assertThatThrownBy(bootstrap::initialize).isInstanceOf(IllegalStateException.class);
    }
}
