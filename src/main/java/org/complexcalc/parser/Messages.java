package org.complexcalc.parser;

import java.util.Locale;
import java.util.MissingResourceException;
import java.util.ResourceBundle;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.complexcalc.util.StrUtil;

/**
 * Per-locale cache of message translators backed by the
 * {@code complexparser} resource bundle of this package.
 */
final class Messages {

  private static final Logger logger = Logger.getLogger(Messages.class.getName());

  static final String BUNDLE = Messages.class.getPackage().getName() + ".complexparser";

  private static final ConcurrentHashMap<Locale, StrUtil> translators =
      new ConcurrentHashMap<Locale, StrUtil>();

  private Messages() {
  }

  static StrUtil forLocale(Locale locale) {
    return translators.computeIfAbsent(locale, l -> new StrUtil(loadBundle(l)));
  }

  static StrUtil forDefaultLocale() {
    return forLocale(Locale.getDefault());
  }

  /**
   * Loads the bundle for the locale. Without a bundle, messages degrade to
   * their keys.
   */
  private static ResourceBundle loadBundle(Locale locale) {
    try {
      // no fallback to the default locale, so that an explicit locale is honoured
      return ResourceBundle.getBundle(BUNDLE, locale, Messages.class.getClassLoader(),
          ResourceBundle.Control.getNoFallbackControl(ResourceBundle.Control.FORMAT_PROPERTIES));
    } catch (MissingResourceException ex) {
      logger.log(Level.WARNING, "Message bundle " + BUNDLE + " not found for " + locale, ex);
      return null;
    }
  }
}
