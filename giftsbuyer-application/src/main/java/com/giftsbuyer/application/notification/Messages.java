package com.giftsbuyer.application.notification;

import java.text.MessageFormat;
import java.util.Locale;
import java.util.MissingResourceException;
import java.util.ResourceBundle;

/**
 * Localized texts from messages_&lt;lang&gt;.properties, English fallback.
 * Arguments are rendered with String.valueOf so numbers are never grouped.
 */
public final class Messages {

    private static final String BUNDLE = "messages";

    private final ResourceBundle bundle;
    private final Locale locale;

    private Messages(ResourceBundle bundle, Locale locale) {
        this.bundle = bundle;
        this.locale = locale;
    }

    public static Messages forLanguage(String language) {
        Locale locale = (language == null || language.isBlank())
                ? Locale.ENGLISH
                : Locale.forLanguageTag(language.trim().toLowerCase(Locale.ROOT));
        ResourceBundle rb = ResourceBundle.getBundle(BUNDLE, locale,
                ResourceBundle.Control.getNoFallbackControl(ResourceBundle.Control.FORMAT_PROPERTIES));
        return new Messages(rb, locale);
    }

    public String format(String key, Object... args) {
        String pattern;
        try {
            pattern = bundle.getString(key);
        } catch (MissingResourceException e) {
            return key;
        }
        Object[] rendered = new Object[args.length];
        for (int i = 0; i < args.length; i++) {
            rendered[i] = String.valueOf(args[i]);
        }
        return new MessageFormat(pattern, locale).format(rendered);
    }
}
