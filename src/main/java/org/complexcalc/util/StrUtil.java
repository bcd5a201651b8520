package org.complexcalc.util;

import java.util.MissingResourceException;
import java.util.ResourceBundle;

/**
 * Looks up message templates in a resource bundle and fills their
 * {@code {0}}, {@code {1}} ... placeholders. Unknown keys, or a missing
 * bundle, yield the key itself so that a message is never lost.
 */
public class StrUtil {
  private final ResourceBundle res;

  public StrUtil(ResourceBundle bundle) {
    res = bundle;
  }

  public String getMessage(String key) {
    if (res == null) {
      return key;
    }
    try {
      String s = res.getString(key);
      return s == null ? key : s;
    } catch (MissingResourceException ex) {
      return key;
    }
  }

  public String getMessage(String key, Object... params) {
    String temp = getMessage(key);
    for (int i = 0; i < params.length; i++) {
      temp = temp.replace("{" + i + "}", String.valueOf(params[i]));
    }
    return temp;
  }
}
