package com.quantori.csp.core.layout;

/**
 * Measures atom labels. Renderers plug in their font metrics.
 */
@FunctionalInterface
public interface TextMeasurer {

  TextBox measure(String text);

  /**
   * A measurer giving every character the same width.
   *
   * @param charWidth  width of one character
   * @param lineHeight height of a label
   * @return the measurer
   */
  static TextMeasurer monospace(double charWidth, double lineHeight) {
    return text -> new TextBox(text.length() * charWidth, lineHeight);
  }

  record TextBox(double width, double height) {
  }
}
