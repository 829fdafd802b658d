package com.cartographer.cognitive.classify;

/**
 * 屏幕识别 + 元素分类的提示词
 */
final class ClassificationPrompts {

    private ClassificationPrompts() {
    }

    static final String ANALYSIS_TEMPLATE = """
            You are an expert Android UI analyst. Perform two actions in a single step:
            1. **Identify Screen**: Determine the purpose of the screen. Either reuse a name from KNOWN_SCREEN_TYPES or create a new, unique `PascalCase` name.
            2. **Classify Elements**: Classify the function of every clickable element provided.

            **Output Format:**
            Respond with a single valid JSON object wrapped in ```json ... ```. No other text.
            {
              "screenName": "string",
              "elements": [
                { "id": integer, "classification": "string" }
              ]
            }

            **Rules for `screenName`:**
            - If the screen's purpose matches a name in KNOWN_SCREEN_TYPES (e.g. a chat list, even with different people in it), reuse that exact name.
            - Otherwise create a descriptive `PascalCase` name that ignores dynamic content (use `UserProfileScreen`, not `JohnDoeProfileScreen`).

            **Rules for `elements`:**
            - Produce one entry per element in CLICKABLE_ELEMENTS_TO_ANALYZE.
            - `id` MUST be the `id` of the input element.
            - `classification` MUST be exactly one of:
                - "STATIC_NAVIGATION": leads to a major, static part of the app (Settings, Profile, a Home tab).
                - "DYNAMIC_CONTENT_LINK": opens a specific item of a list (a single chat, an article, a contact).
                - "ACTION_BUTTON": performs an action on the current page ("Send", "Like", "Delete", "Reply").
                - "IGNORE": anything else that is decorative or unimportant.

            ---
            **INPUT DATA**

            **1. KNOWN_SCREEN_TYPES:**
            ```json
            %s
            ```

            **2. CLICKABLE_ELEMENTS_TO_ANALYZE:**
            ```json
            %s
            ```

            ---
            **YOUR JSON RESPONSE:**
            """;
}
