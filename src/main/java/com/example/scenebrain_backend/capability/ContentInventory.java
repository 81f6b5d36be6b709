package com.example.scenebrain_backend.capability;

import com.example.scenebrain_backend.api.OrchestrationRequest;
import com.example.scenebrain_backend.context.ContextBundle;
import com.example.scenebrain_backend.context.ImageFact;
import com.example.scenebrain_backend.selector.AvailableContent;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Estimates which content a new scene can draw on, for the template content-availability score.
 */
@Component
public class ContentInventory {

    private static final Pattern LOGO = Pattern.compile("\\blogo\\b");
    private static final Pattern SCREENSHOT = Pattern.compile("\\b(screenshots?|screen ?grabs?|ui shots?)\\b");
    private static final Pattern SOCIAL_PROOF = Pattern.compile(
            "\\b(testimonials?|reviews?|trusted by|customers?|ratings?|case stud(y|ies)|logos of)\\b");
    private static final Pattern BULLET = Pattern.compile("(?m)^\\s*([-*\\u2022]|\\d+[.)])\\s+\\S");
    private static final Pattern FEATURE_LIST = Pattern.compile("features?\\s*:\\s*([^.\\n]+)");

    public AvailableContent inspect(OrchestrationRequest request, ContextBundle bundle) {
        String text = request.prompt().toLowerCase(Locale.ROOT);
        boolean images = !request.attachedImageRefs().isEmpty();
        boolean logo = LOGO.matcher(text).find()
                || bundle.imageFacts().stream().anyMatch(ContentInventory::looksLikeLogo);
        boolean screenshots = SCREENSHOT.matcher(text).find() || images;
        boolean socialProof = SOCIAL_PROOF.matcher(text).find();
        return new AvailableContent(logo, socialProof, screenshots, featureCount(request.prompt()));
    }

    static int featureCount(String prompt) {
        int bullets = 0;
        Matcher m = BULLET.matcher(prompt);
        while (m.find()) {
            bullets++;
        }
        if (bullets > 0) {
            return bullets;
        }
        Matcher list = FEATURE_LIST.matcher(prompt.toLowerCase(Locale.ROOT));
        if (list.find()) {
            return (int) Arrays.stream(list.group(1).split("\\s*(,|\\band\\b)\\s*"))
                    .filter(part -> !part.isBlank())
                    .count();
        }
        return 0;
    }

    private static boolean looksLikeLogo(ImageFact fact) {
        String layout = fact.layout() == null ? "" : fact.layout().toLowerCase(Locale.ROOT);
        return layout.contains("logo");
    }
}
