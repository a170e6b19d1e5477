package ir.ipaam.receiptservice.application.config;

import ir.ipaam.receiptservice.domain.model.valueobject.PageGeometry;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Receipt layout, letterhead lookup and output settings, bound from {@code receipt.*}.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "receipt")
public class ReceiptProperties {

    private Page page = new Page();
    private Letterhead letterhead = new Letterhead();
    private Output output = new Output();
    private Fonts fonts = new Fonts();
    private Substitution substitution = new Substitution();
    private Heuristics heuristics = new Heuristics();
    private DefaultTemplate defaultTemplate = new DefaultTemplate();

    public PageGeometry toGeometry() {
        return new PageGeometry(page.width, page.height,
                page.marginLeft, page.marginTop, page.marginRight, page.marginBottom,
                page.fontSize, page.lineHeight, page.paragraphGap, page.listIndent);
    }

    // Points; defaults are US Letter with a 2in left/top margin
    @Getter
    @Setter
    public static class Page {
        private float width = 612f;
        private float height = 792f;
        private float marginLeft = 144f;
        private float marginTop = 144f;
        private float marginRight = 72f;
        private float marginBottom = 36f;
        private float fontSize = 12f;
        private float lineHeight = 16f;
        private float paragraphGap = 12f;
        private float listIndent = 18f;
    }

    @Getter
    @Setter
    public static class Letterhead {
        /** Checked first when set. */
        private String overridePath;
        /** Resolved against the working directory, in order. */
        private List<String> packagedLocations = new ArrayList<>(List.of(
                "NSNA Atlanta Letterhead Updated.pdf",
                "src/templates/letterhead_template.pdf"));
        private String userDataLocation = System.getProperty("user.home")
                + "/NSNA_Mail_Merge_Data/data/NSNA Atlanta Letterhead Updated.pdf";
    }

    @Getter
    @Setter
    public static class Output {
        private String directory = System.getProperty("user.home") + "/Documents/NSNA Receipts";
        private String organizationPrefix = "NSNA";
    }

    /** Classpath TrueType resources; blank entries fall back to the Helvetica family. */
    @Getter
    @Setter
    public static class Fonts {
        private String regular;
        private String bold;
        private String italic;
        private String boldItalic;
        /** AWT family used by the raster backend. */
        private String rasterFamily = "SansSerif";
    }

    @Getter
    @Setter
    public static class Substitution {
        private String datePattern = "MMMM dd, yyyy";
        private List<String> monetaryFields = new ArrayList<>(List.of("Donation Amount", "Amount", "Value of Item"));
    }

    @Getter
    @Setter
    public static class Heuristics {
        private List<String> boldKeywords = new ArrayList<>(List.of("dear", "donation amount", "donation(s) year"));
        private int rasterDpi = 150;
    }

    /** Pieces of the letter used when a request carries no template. Blank pieces are left out. */
    @Getter
    @Setter
    public static class DefaultTemplate {
        private String greeting = "Dear";
        private List<String> thankYouLines = new ArrayList<>(List.of(
                "On behalf of Nagarathar Sangam of North America, thank you for your recent",
                "donation to our organization."));
        private String receiptStatement =
                "This letter will serve as a tax receipt for your contribution listed below.";
        private String amountLabel = "Donation Amount:";
        private String yearLabel = "Donation(s) Year:";
        /** Fixed year; blank means the year of generation. */
        private String donationYear;
        private String disclaimer = "No goods or services were provided in exchange for your contribution.";
        private List<String> orgInfo = new ArrayList<>(List.of(
                "Nagarathar Sangam of North America is a registered Section 501(c)(3) non-",
                "profit organization (EIN #: 22-3974176). For questions regarding this",
                "acknowledgment letter, please contact us at treasurer@achi.org."));
        private List<String> closingLines = new ArrayList<>(List.of(
                "We truly appreciate your donation and look forward to your continued support",
                "of our mission."));
        /** One line each; an empty entry leaves a blank line. */
        private List<String> signature = new ArrayList<>(List.of(
                "Sincerely,", "", "Treasurer, NSNA", "(2025-2026 term)"));
    }
}
