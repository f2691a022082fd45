package com.newsrelay.collectors.classify;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

public final class HashtagTaxonomy {
    public static final String RUSSIA = "#Russia";
    public static final String WORLD = "#World";
    public static final String DEFAULT_RUBRIC = "#Society";

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS;

    public enum FederalDistrict {
        CENTRAL("#CentralFD"),
        NORTHWEST("#NorthwestFD"),
        SOUTH("#SouthFD"),
        NORTH_CAUCASUS("#NorthCaucasusFD"),
        VOLGA("#VolgaFD"),
        URAL("#UralFD"),
        SIBERIA("#SiberiaFD"),
        FAR_EAST("#FarEastFD");

        private final String tag;

        FederalDistrict(String tag) {
            this.tag = tag;
        }

        public String tag() {
            return tag;
        }
    }

    public record Region(String tag, FederalDistrict district, String capitalTag, Pattern aliases) {
    }

    public record City(String tag, String regionTag, Pattern aliases) {
    }

    public record Rubric(String tag, Pattern keywords) {
    }

    private static final List<Region> REGIONS = List.of(
            region("#Moscow", FederalDistrict.CENTRAL, "#Moscow", "\\bмоскв(а|е|у|ы|ой)\\b|\\bmoscow\\b(?! region| oblast)"),
            region("#MoscowOblast", FederalDistrict.CENTRAL, "#Krasnogorsk",
                    oblast("московск") + "|\\bподмосковь|\\bmoscow (region|oblast)\\b"),
            region("#BelgorodOblast", FederalDistrict.CENTRAL, "#Belgorod", oblast("белгородск") + "|\\bbelgorod (region|oblast)\\b"),
            region("#BryanskOblast", FederalDistrict.CENTRAL, "#Bryansk", oblast("брянск") + "|\\bbryansk (region|oblast)\\b"),
            region("#VladimirOblast", FederalDistrict.CENTRAL, "#Vladimir", oblast("владимирск")),
            region("#VoronezhOblast", FederalDistrict.CENTRAL, "#Voronezh", oblast("воронежск")),
            region("#IvanovoOblast", FederalDistrict.CENTRAL, "#Ivanovo", oblast("ивановск")),
            region("#KalugaOblast", FederalDistrict.CENTRAL, "#Kaluga", oblast("калужск")),
            region("#KostromaOblast", FederalDistrict.CENTRAL, "#Kostroma", oblast("костромск")),
            region("#KurskOblast", FederalDistrict.CENTRAL, "#Kursk", oblast("курск") + "|\\bkursk (region|oblast)\\b"),
            region("#LipetskOblast", FederalDistrict.CENTRAL, "#Lipetsk", oblast("липецк")),
            region("#OryolOblast", FederalDistrict.CENTRAL, "#Oryol", oblast("орловск")),
            region("#RyazanOblast", FederalDistrict.CENTRAL, "#Ryazan", oblast("рязанск")),
            region("#SmolenskOblast", FederalDistrict.CENTRAL, "#Smolensk", oblast("смоленск")),
            region("#TambovOblast", FederalDistrict.CENTRAL, "#Tambov", oblast("тамбовск")),
            region("#TverOblast", FederalDistrict.CENTRAL, "#Tver", oblast("тверск")),
            region("#TulaOblast", FederalDistrict.CENTRAL, "#Tula", oblast("тульск")),
            region("#YaroslavlOblast", FederalDistrict.CENTRAL, "#Yaroslavl", oblast("ярославск")),
            region("#SaintPetersburg", FederalDistrict.NORTHWEST, "#SaintPetersburg",
                    "\\bсанкт-петербург|\\bпетербург(а|е|у|ом)?\\b|\\bsaint petersburg\\b|\\bst\\.? petersburg\\b"),
            region("#KaliningradOblast", FederalDistrict.NORTHWEST, "#Kaliningrad", oblast("калининградск")),
            region("#KrasnodarKrai", FederalDistrict.SOUTH, "#Krasnodar", "\\bкраснодарск(ий|ого|ом) кра|\\bкубан(ь|и)\\b"),
            region("#RostovOblast", FederalDistrict.SOUTH, "#RostovOnDon", oblast("ростовск")),
            region("#Dagestan", FederalDistrict.NORTH_CAUCASUS, "#Makhachkala", "\\bдагестан|\\bdagestan\\b"),
            region("#Tatarstan", FederalDistrict.VOLGA, "#Kazan", "\\bтатарстан|\\btatarstan\\b"),
            region("#NizhnyNovgorodOblast", FederalDistrict.VOLGA, "#NizhnyNovgorod", oblast("нижегородск")),
            region("#SverdlovskOblast", FederalDistrict.URAL, "#Yekaterinburg", oblast("свердловск")),
            region("#ChelyabinskOblast", FederalDistrict.URAL, "#Chelyabinsk", oblast("челябинск")),
            region("#NovosibirskOblast", FederalDistrict.SIBERIA, "#Novosibirsk", oblast("новосибирск")),
            region("#PrimorskyKrai", FederalDistrict.FAR_EAST, "#Vladivostok", "\\bприморь(е|я|ю)\\b|\\bприморск(ий|ого|ом) кра")
    );

    private static final List<City> CITIES = List.of(
            city("#Moscow", "#Moscow", "\\bмоскв(а|е|у|ы|ой)\\b|\\bmoscow\\b(?! region| oblast)"),
            city("#Krasnogorsk", "#MoscowOblast", "\\bкрасногорск(а|е|у|ом)?\\b"),
            city("#Balashikha", "#MoscowOblast", "\\bбалаших(а|е|у|и)\\b"),
            city("#Khimki", "#MoscowOblast", "\\bхимк(и|ах|ам)\\b"),
            city("#Podolsk", "#MoscowOblast", "\\bподольск(а|е|у|ом)?\\b"),
            city("#Mytishchi", "#MoscowOblast", "\\bмытищ(и|ах|ам)\\b"),
            city("#Lyubertsy", "#MoscowOblast", "\\bлюберц(ы|ах|ам)\\b"),
            city("#Korolyov", "#MoscowOblast", "\\bкорол(е|ё)в(а|е|у)?\\b"),
            city("#Odintsovo", "#MoscowOblast", "\\bодинцово\\b"),
            city("#Kolomna", "#MoscowOblast", "\\bколомн(а|е|у|ы)\\b"),
            city("#Belgorod", "#BelgorodOblast", "\\bбелгород(а|е|у|ом)?\\b|\\bbelgorod\\b(?! region| oblast)"),
            city("#Bryansk", "#BryanskOblast", "\\bбрянск(а|е|у|ом)?\\b"),
            city("#Vladimir", "#VladimirOblast", "\\bво владимире\\b|\\bг\\. владимир\\b"),
            city("#Voronezh", "#VoronezhOblast", "\\bворонеж(а|е|у|ем)?\\b"),
            city("#Ivanovo", "#IvanovoOblast", "\\bиваново\\b"),
            city("#Kaluga", "#KalugaOblast", "\\bкалуг(а|е|у|и)\\b"),
            city("#Kostroma", "#KostromaOblast", "\\bкостром(а|е|у|ы)\\b"),
            city("#Kursk", "#KurskOblast", "\\bкурск(а|е|у|ом)?\\b|\\bkursk\\b(?! region| oblast)"),
            city("#Lipetsk", "#LipetskOblast", "\\bлипецк(а|е|у|ом)?\\b"),
            city("#Oryol", "#OryolOblast", "\\bв орле\\b"),
            city("#Ryazan", "#RyazanOblast", "\\bрязан(ь|и)\\b"),
            city("#Smolensk", "#SmolenskOblast", "\\bсмоленск(а|е|у|ом)?\\b"),
            city("#Tambov", "#TambovOblast", "\\bтамбов(а|е|у|ом)?\\b"),
            city("#Tver", "#TverOblast", "\\bтвер(ь|и)\\b"),
            city("#Tula", "#TulaOblast", "\\bтул(а|е|у|ы)\\b"),
            city("#Yaroslavl", "#YaroslavlOblast", "\\bярославл(ь|е|я)\\b"),
            city("#SaintPetersburg", "#SaintPetersburg", "\\bсанкт-петербург|\\bпетербург(а|е|у|ом)?\\b|\\bsaint petersburg\\b"),
            city("#Kaliningrad", "#KaliningradOblast", "\\bкалининград(а|е|у)?\\b"),
            city("#Krasnodar", "#KrasnodarKrai", "\\bкраснодар(а|е|у)?\\b"),
            city("#RostovOnDon", "#RostovOblast", "\\bростов(а|е)?-на-дону\\b"),
            city("#Makhachkala", "#Dagestan", "\\bмахачкал(а|е|у|ы)\\b"),
            city("#Kazan", "#Tatarstan", "\\bказан(ь|и)\\b|\\bkazan\\b"),
            city("#NizhnyNovgorod", "#NizhnyNovgorodOblast", "\\bнижн(ий|ем|его) новгород"),
            city("#Yekaterinburg", "#SverdlovskOblast", "\\bекатеринбург(а|е|у)?\\b|\\byekaterinburg\\b"),
            city("#Chelyabinsk", "#ChelyabinskOblast", "\\bчелябинск(а|е|у)?\\b"),
            city("#Novosibirsk", "#NovosibirskOblast", "\\bновосибирск(а|е|у)?\\b|\\bnovosibirsk\\b"),
            city("#Vladivostok", "#PrimorskyKrai", "\\bвладивосток(а|е|у)?\\b|\\bvladivostok\\b")
    );

    private static final List<Rubric> RUBRICS = List.of(
            rubric("#Politics", "\\bвыбор", "\\bпрезидент", "\\bгосдум", "\\bдум(а|ы|е)\\b", "\\bкремл", "\\bгубернатор",
                    "\\bзакон", "\\bсанкц", "\\bпарламент", "\\bправительств", "\\bминистр", "\\belection",
                    "\\bpresident", "\\bparliament", "\\bsanction", "\\bgovernment"),
            rubric("#Economy", "\\bэконом", "\\bинфляц", "\\bрубл", "\\bдоллар", "\\bфинанс", "\\bбанк", "\\bбюджет",
                    "\\bрын(ок|ка|ке)\\b", "\\bналог", "\\beconom", "\\binflation", "\\bbudget", "\\bbank"),
            rubric("#Sports", "\\bспорт", "\\bматч", "\\bчемпионат", "\\bлиг(а|и|е|у)\\b", "\\bкуб(ок|ка|ке)\\b",
                    "\\bхокке", "\\bфутбол", "\\bолимпи", "\\bsport", "\\bfootball", "\\bhockey", "\\bolympic"),
            rubric("#TechMedia", "\\bтехнолог", "\\bцифров", "\\bинтернет", "\\bнейросет", "\\bискусственн(ый|ого) интеллект",
                    "\\bсоцсет", "\\bмедиа\\b", "\\bсмартфон", "\\btechnolog", "\\binternet", "\\bdigital"),
            rubric("#Education", "\\bшкол", "\\bвуз", "\\bуниверситет", "\\bэкзамен", "\\bегэ\\b", "\\bстудент",
                    "\\bобразован", "\\bschool", "\\buniversit", "\\bstudent"),
            rubric("#Culture", "\\bкультур", "\\bмузе", "\\bтеатр", "\\bвыставк", "\\bискусств", "\\bконцерт",
                    "\\bфестивал", "\\bculture", "\\bmuseum", "\\btheat(re|er)", "\\bexhibition"),
            rubric("#Auto", "\\bавто", "\\bдтп\\b", "\\bводител", "\\bшоссе", "\\bтрасс", "\\bдорог", "\\bтранспорт",
                    "\\bcar\\b", "\\broad", "\\btraffic"),
            rubric("#Society", "\\bжител", "\\bгорожан", "\\bсоциальн", "\\bмедицин", "\\bбольниц", "\\bпожар",
                    "\\bавари", "\\bчп\\b", "\\bпогиб", "\\bполици", "\\bблагоустр", "\\bпарк", "\\bresident",
                    "\\bhospital", "\\bpolice")
    );

    private static final Pattern RUSSIA_MARKERS = Pattern.compile(
            "\\bросси(я|и|ю|ей)\\b|\\bрф\\b|\\bроссийск|\\bфедерац|\\brussia", FLAGS);
    private static final Pattern WORLD_MARKERS = Pattern.compile(
            "\\bсша\\b|\\bгермани|\\bкита(й|я|е)|\\bфранци|\\bитали|\\bиспани|\\bбритани|\\bукраин|\\bизраил|\\bтурци"
                    + "|\\bпариж|\\bлондон|\\bберлин|\\bевросоюз|\\bнато\\b|\\bоон\\b|\\busa\\b|\\bunited states\\b|\\bchina\\b"
                    + "|\\beuropean union\\b|\\bnato\\b", FLAGS);

    private HashtagTaxonomy() {
    }

    public static Optional<Region> findRegion(String text) {
        return REGIONS.stream().filter(region -> region.aliases().matcher(text).find()).findFirst();
    }

    public static Optional<City> findCity(String text) {
        return CITIES.stream().filter(city -> city.aliases().matcher(text).find()).findFirst();
    }

    public static Optional<City> findCityIn(String text, String regionTag) {
        return CITIES.stream()
                .filter(city -> city.regionTag().equals(regionTag))
                .filter(city -> city.aliases().matcher(text).find())
                .findFirst();
    }

    public static Optional<Region> region(String tag) {
        return REGIONS.stream().filter(region -> region.tag().equals(tag)).findFirst();
    }

    public static Optional<City> city(String tag) {
        return CITIES.stream().filter(city -> city.tag().equals(tag)).findFirst();
    }

    public static Optional<FederalDistrict> district(String tag) {
        return Arrays.stream(FederalDistrict.values()).filter(district -> district.tag().equals(tag)).findFirst();
    }

    public static Optional<String> findRubric(String text) {
        String best = null;
        int bestHits = 0;
        for (Rubric rubric : RUBRICS) {
            int hits = 0;
            Matcher matcher = rubric.keywords().matcher(text);
            while (matcher.find()) {
                hits++;
            }
            if (hits > bestHits) {
                best = rubric.tag();
                bestHits = hits;
            }
        }
        return Optional.ofNullable(best);
    }

    public static boolean isRubric(String tag) {
        return RUBRICS.stream().anyMatch(rubric -> rubric.tag().equals(tag));
    }

    public static boolean mentionsRussia(String text) {
        return RUSSIA_MARKERS.matcher(text).find();
    }

    public static boolean mentionsWorld(String text) {
        return WORLD_MARKERS.matcher(text).find();
    }

    public static List<String> districtTags() {
        return Arrays.stream(FederalDistrict.values()).map(FederalDistrict::tag).toList();
    }

    public static List<String> regionTags() {
        return REGIONS.stream().map(Region::tag).toList();
    }

    public static List<String> cityTags() {
        return CITIES.stream().map(City::tag).distinct().toList();
    }

    public static List<String> rubricTags() {
        return RUBRICS.stream().map(Rubric::tag).toList();
    }

    public static Set<String> allTags() {
        Set<String> all = new LinkedHashSet<>(List.of(RUSSIA, WORLD));
        all.addAll(districtTags());
        all.addAll(regionTags());
        all.addAll(cityTags());
        all.addAll(rubricTags());
        return all;
    }

    private static String oblast(String stem) {
        return "\\b" + stem + "(ая|ой|ую) област";
    }

    private static Region region(String tag, FederalDistrict district, String capitalTag, String aliases) {
        return new Region(tag, district, capitalTag, Pattern.compile(aliases, FLAGS));
    }

    private static City city(String tag, String regionTag, String aliases) {
        return new City(tag, regionTag, Pattern.compile(aliases, FLAGS));
    }

    private static Rubric rubric(String tag, String... keywords) {
        return new Rubric(tag, Pattern.compile(Arrays.stream(keywords).collect(Collectors.joining("|")), FLAGS));
    }
}
