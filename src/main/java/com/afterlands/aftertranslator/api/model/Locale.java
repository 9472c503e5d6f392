package com.afterlands.aftertranslator.api.model;

import com.afterlands.aftertranslator.api.exception.LocaleParseException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Supported locales.
 *
 * <p>Closed set of ISO 639-1 languages, some of them with regional variants
 * (e.g. {@link #ENGLISH_UNITED_STATES}, {@link #CHINESE_TAIWAN}). Every
 * regional variant falls back to its base language; base languages have
 * no parent.</p>
 *
 * <h3>Tags:</h3>
 * <pre>
 * ENGLISH                -> "en"
 * ENGLISH_UNITED_STATES  -> "en_US"
 * PORTUGUESE_BRAZIL      -> "pt_BR"
 * </pre>
 *
 * <p>{@link #fromTag(String)} accepts both {@code _} and {@code -} as
 * separator and ignores case, so request headers ({@code en-us}) and file
 * names ({@code en_US}) resolve to the same constant.</p>
 *
 * @see #parentFallback()
 */
public enum Locale {

    AFAR("aa", null, "Afar"),
    ABKHAZIAN("ab", null, "Abkhazian"),
    AFRIKAANS("af", null, "Afrikaans"),
    AKAN("ak", null, "Akan"),
    ALBANIAN("sq", null, "Albanian"),
    AMHARIC("am", null, "Amharic"),
    ARABIC("ar", null, "Arabic"),
    ARABIC_ALGERIA("ar", "DZ", "Arabic (Algeria)"),
    ARABIC_BAHRAIN("ar", "BH", "Arabic (Bahrain)"),
    ARABIC_EGYPT("ar", "EG", "Arabic (Egypt)"),
    ARABIC_IRAQ("ar", "IQ", "Arabic (Iraq)"),
    ARABIC_JORDAN("ar", "JO", "Arabic (Jordan)"),
    ARABIC_KUWAIT("ar", "KW", "Arabic (Kuwait)"),
    ARABIC_LEBANON("ar", "LB", "Arabic (Lebanon)"),
    ARABIC_LIBYA("ar", "LY", "Arabic (Libya)"),
    ARABIC_MOROCCO("ar", "MA", "Arabic (Morocco)"),
    ARABIC_OMAN("ar", "OM", "Arabic (Oman)"),
    ARABIC_QATAR("ar", "QA", "Arabic (Qatar)"),
    ARABIC_SAUDI_ARABIA("ar", "SA", "Arabic (Saudi Arabia)"),
    ARABIC_SYRIA("ar", "SY", "Arabic (Syria)"),
    ARABIC_TUNISIA("ar", "TN", "Arabic (Tunisia)"),
    ARABIC_UNITED_ARAB_EMIRATES("ar", "AE", "Arabic (United Arab Emirates)"),
    ARABIC_YEMEN("ar", "YE", "Arabic (Yemen)"),
    ARAGONESE("an", null, "Aragonese"),
    ARMENIAN("hy", null, "Armenian"),
    ASSAMESE("as", null, "Assamese"),
    AVARIC("av", null, "Avaric"),
    AVESTAN("ae", null, "Avestan"),
    AYMARA("ay", null, "Aymara"),
    AZERBAIJANI("az", null, "Azerbaijani"),
    BASHKIR("ba", null, "Bashkir"),
    BAMBARA("bm", null, "Bambara"),
    BASQUE("eu", null, "Basque"),
    BELARUSIAN("be", null, "Belarusian"),
    BENGALI("bn", null, "Bengali"),
    BIHARI("bh", null, "Bihari"),
    BISLAMA("bi", null, "Bislama"),
    TIBETAN("bo", null, "Tibetan"),
    BOSNIAN("bs", null, "Bosnian"),
    BRETON("br", null, "Breton"),
    BULGARIAN("bg", null, "Bulgarian"),
    BURMESE("my", null, "Burmese"),
    CATALAN("ca", null, "Catalan"),
    CZECH("cs", null, "Czech"),
    CHAMORRO("ch", null, "Chamorro"),
    CHECHEN("ce", null, "Chechen"),
    CHINESE("zh", null, "Chinese"),
    CHINESE_HONG_KONG("zh", "HK", "Chinese (Hong Kong)"),
    CHINESE_CHINA("zh", "CN", "Chinese (China)"),
    CHINESE_SINGAPORE("zh", "SG", "Chinese (Singapore)"),
    CHINESE_TAIWAN("zh", "TW", "Chinese (Taiwan)"),
    CHURCH_SLAVIC("cu", null, "Church Slavic"),
    CHUVASH("cv", null, "Chuvash"),
    CORNISH("kw", null, "Cornish"),
    CORSICAN("co", null, "Corsican"),
    CREE("cr", null, "Cree"),
    WELSH("cy", null, "Welsh"),
    DANISH("da", null, "Danish"),
    GERMAN("de", null, "German"),
    GERMAN_AUSTRIA("de", "AT", "German (Austria)"),
    GERMAN_LIECHTENSTEIN("de", "LI", "German (Liechtenstein)"),
    GERMAN_LUXEMBOURG("de", "LU", "German (Luxembourg)"),
    GERMAN_SWITZERLAND("de", "CH", "German (Switzerland)"),
    DIVEHI("dv", null, "Divehi"),
    DUTCH("nl", null, "Dutch"),
    DUTCH_BELGIUM("nl", "BE", "Dutch (Belgium)"),
    DZONGKHA("dz", null, "Dzongkha"),
    GREEK("el", null, "Greek"),
    ENGLISH("en", null, "English"),
    ENGLISH_AUSTRALIA("en", "AU", "English (Australia)"),
    ENGLISH_BELIZE("en", "BZ", "English (Belize)"),
    ENGLISH_CANADA("en", "CA", "English (Canada)"),
    ENGLISH_IRELAND("en", "IE", "English (Ireland)"),
    ENGLISH_JAMAICA("en", "JM", "English (Jamaica)"),
    ENGLISH_NEW_ZEALAND("en", "NZ", "English (New Zealand)"),
    ENGLISH_SOUTH_AFRICA("en", "ZA", "English (South Africa)"),
    ENGLISH_TRINIDAD("en", "TT", "English (Trinidad)"),
    ENGLISH_UNITED_KINGDOM("en", "GB", "English (United Kingdom)"),
    ENGLISH_UNITED_STATES("en", "US", "English (United States)"),
    ESPERANTO("eo", null, "Esperanto"),
    ESTONIAN("et", null, "Estonian"),
    EWE("ee", null, "Ewe"),
    FAROESE("fo", null, "Faroese"),
    PERSIAN("fa", null, "Persian"),
    FIJIAN("fj", null, "Fijian"),
    FINNISH("fi", null, "Finnish"),
    FRENCH("fr", null, "French"),
    FRENCH_FRANCE("fr", "FR", "French (France)"),
    FRENCH_BELGIUM("fr", "BE", "French (Belgium)"),
    FRENCH_CANADA("fr", "CA", "French (Canada)"),
    FRENCH_LUXEMBOURG("fr", "LU", "French (Luxembourg)"),
    FRENCH_SWITZERLAND("fr", "CH", "French (Switzerland)"),
    WESTERN_FRISIAN("fy", null, "Western Frisian"),
    FULAH("ff", null, "Fulah"),
    GEORGIAN("ka", null, "Georgian"),
    GAELIC("gd", null, "Gaelic"),
    IRISH("ga", null, "Irish"),
    GALICIAN("gl", null, "Galician"),
    MANX("gv", null, "Manx"),
    GUARANI("gn", null, "Guarani"),
    GUJARATI("gu", null, "Gujarati"),
    HAITIAN("ht", null, "Haitian"),
    HAUSA("ha", null, "Hausa"),
    HEBREW("he", null, "Hebrew"),
    HERERO("hz", null, "Herero"),
    HINDI("hi", null, "Hindi"),
    HIRI_MOTU("ho", null, "Hiri Motu"),
    CROATIAN("hr", null, "Croatian"),
    HUNGARIAN("hu", null, "Hungarian"),
    IGBO("ig", null, "Igbo"),
    ICELANDIC("is", null, "Icelandic"),
    IDO("io", null, "Ido"),
    SICHUAN_YI("ii", null, "Sichuan Yi"),
    INUKTITUT("iu", null, "Inuktitut"),
    INTERLINGUE("ie", null, "Interlingue"),
    INDONESIAN("id", null, "Indonesian"),
    INUPIAQ("ik", null, "Inupiaq"),
    ITALIAN("it", null, "Italian"),
    ITALIAN_SWITZERLAND("it", "CH", "Italian (Switzerland)"),
    JAVANESE("jv", null, "Javanese"),
    JAPANESE("ja", null, "Japanese"),
    KALAALLISUT("kl", null, "Kalaallisut"),
    KANNADA("kn", null, "Kannada"),
    KASHMIRI("ks", null, "Kashmiri"),
    KANURI("kr", null, "Kanuri"),
    KAZAKH("kk", null, "Kazakh"),
    CENTRAL_KHMER("km", null, "Central Khmer"),
    KIKUYU("ki", null, "Kikuyu"),
    KINYARWANDA("rw", null, "Kinyarwanda"),
    KIRGHIZ("ky", null, "Kirghiz"),
    KOMI("kv", null, "Komi"),
    KONGO("kg", null, "Kongo"),
    KOREAN("ko", null, "Korean"),
    KUANYAMA("kj", null, "Kuanyama"),
    KURDISH("ku", null, "Kurdish"),
    LAO("lo", null, "Lao"),
    LATIN("la", null, "Latin"),
    LATVIAN("lv", null, "Latvian"),
    LIMBURGAN("li", null, "Limburgan"),
    LINGALA("ln", null, "Lingala"),
    LITHUANIAN("lt", null, "Lithuanian"),
    LUXEMBOURGISH("lb", null, "Luxembourgish"),
    LUBA_KATANGA("lu", null, "Luba Katanga"),
    GANDA("lg", null, "Ganda"),
    MACEDONIAN("mk", null, "Macedonian"),
    MARSHALLESE("mh", null, "Marshallese"),
    MALAYALAM("ml", null, "Malayalam"),
    MAORI("mi", null, "Maori"),
    MARATHI("mr", null, "Marathi"),
    MALAY("ms", null, "Malay"),
    MALAGASY("mg", null, "Malagasy"),
    MALTESE("mt", null, "Maltese"),
    MONGOLIAN("mn", null, "Mongolian"),
    NAURU("na", null, "Nauru"),
    NAVAJO("nv", null, "Navajo"),
    SOUTHERN_NDEBELE("nr", null, "Southern Ndebele"),
    NORTHERN_NDEBELE("nd", null, "Northern Ndebele"),
    NDONGA("ng", null, "Ndonga"),
    NEPALI("ne", null, "Nepali"),
    NORWEGIAN_NYNORSK("nn", null, "Norwegian Nynorsk"),
    NORWEGIAN("no", null, "Norwegian"),
    CHICHEWA("ny", null, "Chichewa"),
    OCCITAN("oc", null, "Occitan"),
    OJIBWA("oj", null, "Ojibwa"),
    ORIYA("or", null, "Oriya"),
    OROMO("om", null, "Oromo"),
    OSSETIAN("os", null, "Ossetian"),
    PANJABI("pa", null, "Panjabi"),
    PALI("pi", null, "Pali"),
    POLISH("pl", null, "Polish"),
    PORTUGUESE("pt", null, "Portuguese"),
    PORTUGUESE_BRAZIL("pt", "BR", "Portuguese (Brazil)"),
    PUSHTO("ps", null, "Pushto"),
    QUECHUA("qu", null, "Quechua"),
    ROMANSH("rm", null, "Romansh"),
    ROMANIAN("ro", null, "Romanian"),
    ROMANIAN_MOLDOVA("ro", "MD", "Romanian (Moldova)"),
    RUNDI("rn", null, "Rundi"),
    RUSSIAN("ru", null, "Russian"),
    RUSSIAN_MOLDOVA("ru", "MD", "Russian (Moldova)"),
    SANGO("sg", null, "Sango"),
    SANSKRIT("sa", null, "Sanskrit"),
    SINHALA("si", null, "Sinhala"),
    SLOVAK("sk", null, "Slovak"),
    SLOVENIAN("sl", null, "Slovenian"),
    NORTHERN_SAMI("se", null, "Northern Sami"),
    SAMOAN("sm", null, "Samoan"),
    SHONA("sn", null, "Shona"),
    SINDHI("sd", null, "Sindhi"),
    SOMALI("so", null, "Somali"),
    SOUTHERN_SOTHO("st", null, "Southern Sotho"),
    SPANISH("es", null, "Spanish"),
    SPANISH_ARGENTINA("es", "AR", "Spanish (Argentina)"),
    SPANISH_BOLIVIA("es", "BO", "Spanish (Bolivia)"),
    SPANISH_CHILE("es", "CL", "Spanish (Chile)"),
    SPANISH_COLOMBIA("es", "CO", "Spanish (Colombia)"),
    SPANISH_COSTA_RICA("es", "CR", "Spanish (Costa Rica)"),
    SPANISH_DOMINICAN_REPUBLIC("es", "DO", "Spanish (Dominican Republic)"),
    SPANISH_ECUADOR("es", "EC", "Spanish (Ecuador)"),
    SPANISH_EL_SALVADOR("es", "SV", "Spanish (El Salvador)"),
    SPANISH_GUATEMALA("es", "GT", "Spanish (Guatemala)"),
    SPANISH_HONDURAS("es", "HN", "Spanish (Honduras)"),
    SPANISH_MEXICO("es", "MX", "Spanish (Mexico)"),
    SPANISH_NICARAGUA("es", "NI", "Spanish (Nicaragua)"),
    SPANISH_PANAMA("es", "PA", "Spanish (Panama)"),
    SPANISH_PARAGUAY("es", "PY", "Spanish (Paraguay)"),
    SPANISH_PERU("es", "PE", "Spanish (Peru)"),
    SPANISH_PUERTO_RICO("es", "PR", "Spanish (Puerto Rico)"),
    SPANISH_URUGUAY("es", "UY", "Spanish (Uruguay)"),
    SPANISH_VENEZUELA("es", "VE", "Spanish (Venezuela)"),
    SARDINIAN("sc", null, "Sardinian"),
    SERBIAN("sr", null, "Serbian"),
    SWATI("ss", null, "Swati"),
    SUNDANESE("su", null, "Sundanese"),
    SWAHILI("sw", null, "Swahili"),
    SWEDISH("sv", null, "Swedish"),
    SWEDISH_FINLAND("sv", "FI", "Swedish (Finland)"),
    TAHITIAN("ty", null, "Tahitian"),
    TAMIL("ta", null, "Tamil"),
    TATAR("tt", null, "Tatar"),
    TELUGU("te", null, "Telugu"),
    TAJIK("tg", null, "Tajik"),
    TAGALOG("tl", null, "Tagalog"),
    THAI("th", null, "Thai"),
    TIGRINYA("ti", null, "Tigrinya"),
    TONGA("to", null, "Tonga"),
    TSWANA("tn", null, "Tswana"),
    TSONGA("ts", null, "Tsonga"),
    TURKMEN("tk", null, "Turkmen"),
    TURKISH("tr", null, "Turkish"),
    TWI("tw", null, "Twi"),
    UIGHUR("ug", null, "Uighur"),
    UKRAINIAN("uk", null, "Ukrainian"),
    URDU("ur", null, "Urdu"),
    UZBEK("uz", null, "Uzbek"),
    VENDA("ve", null, "Venda"),
    VIETNAMESE("vi", null, "Vietnamese"),
    WALLOON("wa", null, "Walloon"),
    WOLOF("wo", null, "Wolof"),
    XHOSA("xh", null, "Xhosa"),
    YIDDISH("yi", null, "Yiddish"),
    YORUBA("yo", null, "Yoruba"),
    ZHUANG("za", null, "Zhuang"),
    ZULU("zu", null, "Zulu");

    private static final Map<String, Locale> BY_TAG;
    private static final Map<String, Locale> BASES;

    static {
        Map<String, Locale> byTag = new HashMap<>();
        Map<String, Locale> bases = new HashMap<>();
        for (Locale locale : values()) {
            byTag.put(normalize(locale.tag), locale);
            if (locale.region == null) {
                bases.put(locale.language, locale);
            }
        }
        BY_TAG = Collections.unmodifiableMap(byTag);
        BASES = Collections.unmodifiableMap(bases);
    }

    private final String language;
    private final String region;
    private final String displayName;
    private final String tag;

    Locale(@NotNull String language, @Nullable String region, @NotNull String displayName) {
        this.language = language;
        this.region = region;
        this.displayName = displayName;
        this.tag = region == null ? language : language + "_" + region;
    }

    /**
     * Parses a locale tag.
     *
     * <p>Examples: {@code "en"}, {@code "en_US"}, {@code "en-us"}, {@code "ZH-tw"}.</p>
     *
     * @param tag Locale tag
     * @return Matching locale
     * @throws LocaleParseException if the tag does not name a supported locale
     */
    @NotNull
    public static Locale fromTag(@NotNull String tag) throws LocaleParseException {
        return lookup(tag).orElseThrow(() -> new LocaleParseException(tag));
    }

    /**
     * Looks up a locale by tag without throwing.
     *
     * @param tag Locale tag (may be null)
     * @return Matching locale, or empty
     */
    @NotNull
    public static Optional<Locale> lookup(@Nullable String tag) {
        if (tag == null || tag.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_TAG.get(normalize(tag)));
    }

    /**
     * Returns the base-language locale of a language code.
     *
     * @param language Two-letter language code
     * @return Base locale, or empty if the language is unsupported
     */
    @NotNull
    public static Optional<Locale> base(@NotNull String language) {
        return Optional.ofNullable(BASES.get(language.toLowerCase(java.util.Locale.ROOT)));
    }

    /**
     * Returns the next coarser locale to try when a message is missing.
     *
     * @return Base language for a regional variant, empty for a base language
     */
    @NotNull
    public Optional<Locale> parentFallback() {
        if (region == null) {
            return Optional.empty();
        }
        return Optional.of(BASES.get(language));
    }

    /**
     * Checks whether this is a base language (no region).
     *
     * @return true if this locale has no parent
     */
    public boolean isBase() {
        return region == null;
    }

    /**
     * Canonical tag, e.g. {@code "en"} or {@code "en_US"}.
     *
     * @return Canonical tag
     */
    @NotNull
    public String tag() {
        return tag;
    }

    /**
     * BCP-47 tag, e.g. {@code "en-US"}.
     *
     * @return Language tag with a hyphen separator
     */
    @NotNull
    public String languageTag() {
        return region == null ? language : language + "-" + region;
    }

    @NotNull
    public String language() {
        return language;
    }

    @Nullable
    public String region() {
        return region;
    }

    @NotNull
    public String displayName() {
        return displayName;
    }

    /**
     * Converts to the JDK locale, for number/date formatting done by callers.
     *
     * @return Equivalent {@link java.util.Locale}
     */
    @NotNull
    public java.util.Locale toJavaLocale() {
        return region == null
                ? new java.util.Locale(language)
                : new java.util.Locale(language, region);
    }

    @NotNull
    private static String normalize(@NotNull String tag) {
        return tag.trim().replace('-', '_').toLowerCase(java.util.Locale.ROOT);
    }

    @Override
    public String toString() {
        return tag;
    }
}
