package fr.lapetina.ocr.pipeline.processing;

/**
 * Builds the text prompt sent alongside a page image.
 */
public class PromptBuilder {

    private static final String INSTRUCTIONS =
            "Attached is the image of one page of a document. Return the text of this page as it would be "
                    + "read naturally, as a JSON object with the fields primary_language, is_rotation_valid, "
                    + "rotation_correction, is_table, is_diagram and natural_text. "
                    + "Set is_rotation_valid to false and rotation_correction to the clockwise angle "
                    + "(90, 180 or 270) needed if the page is not upright.";

    /**
     * @param anchorText text previously extracted from the page, or null to send the image alone
     */
    public String build(String anchorText) {
        if (anchorText == null || anchorText.isBlank()) {
            return INSTRUCTIONS;
        }
        return INSTRUCTIONS
                + "\nRaw text extracted from the page, which may be incomplete or out of order:\n"
                + "RAW_TEXT_START\n" + anchorText + "\nRAW_TEXT_END";
    }
}
