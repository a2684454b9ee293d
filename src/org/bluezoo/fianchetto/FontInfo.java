/*
 * FontInfo.java
 * Copyright (C) 2025 Chris Burdess
 *
 * This file is part of Fianchetto, a PDF reading library.
 *
 * Fianchetto is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * Fianchetto is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Lesser General Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with Fianchetto.  If not, see <http://www.gnu.org/licenses/>.
 */

package org.bluezoo.fianchetto;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * What text extraction needs to know about a font object: its names, its
 * encoding mode and its code to Unicode map, plus whether its program is
 * embedded.
 * <p>
 * Instances are immutable and are cached per document by font object
 * number.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class FontInfo {

    private static final Logger LOGGER = LoggerFactory.getLogger(FontInfo.class);

    private static final Name BASE_ENCODING = new Name("BaseEncoding");
    private static final Name[] FONT_FILES = {
        new Name("FontFile"), new Name("FontFile2"), new Name("FontFile3")
    };

    private final int objectNumber;
    private final String baseFont;
    private final String subtype;
    private final String encoding;
    private final EncodingMode encodingMode;
    private final ToUnicodeMap toUnicode;
    private final boolean embedded;
    private final byte[] fontProgram;

    FontInfo(int objectNumber, String baseFont, String subtype, String encoding,
             EncodingMode encodingMode, ToUnicodeMap toUnicode,
             boolean embedded, byte[] fontProgram) {
        this.objectNumber = objectNumber;
        this.baseFont = baseFont;
        this.subtype = subtype;
        this.encoding = encoding;
        this.encodingMode = encodingMode;
        this.toUnicode = toUnicode;
        this.embedded = embedded;
        this.fontProgram = fontProgram;
    }

    /**
     * Reads the font object with the given number. A missing or malformed
     * font yields an instance with no names, simple encoding and no map.
     *
     * @param objectNumber the font object number
     * @param resolver the document's resolver
     * @return the font information
     */
    public static FontInfo load(int objectNumber, ReferenceResolver resolver) {
        RawObject font = resolver.getStore().get(objectNumber);
        if (font == null || !font.isDictionary()) {
            LOGGER.debug("Font object {} missing or not a dictionary", objectNumber);
            return new FontInfo(objectNumber, null, null, null, EncodingMode.SIMPLE, null, false, null);
        }
        Map<Name, Object> dict = font.getDictionary();
        String baseFont = nameValue(resolver.resolve(dict.get(Name.BASE_FONT)));
        String subtype = nameValue(resolver.resolve(dict.get(Name.SUBTYPE)));
        Object encodingValue = resolver.resolve(dict.get(Name.ENCODING));
        String encoding;
        if (encodingValue instanceof Map) {
            encoding = nameValue(((Map<?, ?>) encodingValue).get(BASE_ENCODING));
        } else {
            encoding = nameValue(encodingValue);
        }
        EncodingMode mode = ("Type0".equals(subtype)
                             || "Identity-H".equals(encoding) || "Identity-V".equals(encoding))
            ? EncodingMode.CID_IDENTITY : EncodingMode.SIMPLE;

        ToUnicodeMap toUnicode = null;
        RawObject cmap = resolver.resolveObject(dict.get(Name.TO_UNICODE));
        if (cmap != null && cmap.hasStream()) {
            if (cmap.getUnappliedFilter() != null) {
                LOGGER.debug("ToUnicode stream of font {} uses unsupported filter {}",
                             objectNumber, cmap.getUnappliedFilter());
            } else {
                toUnicode = ToUnicodeMap.parse(cmap.getStreamBytes());
                if (toUnicode.isEmpty()) {
                    toUnicode = null;
                }
            }
        }

        Map<Name, Object> descriptor = findDescriptor(dict, resolver);
        byte[] program = null;
        boolean embedded = false;
        if (descriptor != null) {
            for (Name key : FONT_FILES) {
                RawObject file = resolver.resolveObject(descriptor.get(key));
                if (file != null && file.hasStream()) {
                    embedded = true;
                    program = file.getStreamBytes();
                    break;
                }
            }
        }
        return new FontInfo(objectNumber, baseFont, subtype, encoding, mode, toUnicode, embedded, program);
    }

    /**
     * Returns the font descriptor of a font, or of its first descendant
     * for a composite font.
     */
    private static Map<Name, Object> findDescriptor(Map<Name, Object> dict, ReferenceResolver resolver) {
        Map<Name, Object> descriptor = resolver.resolveDictionary(dict.get(Name.FONT_DESCRIPTOR));
        if (descriptor != null) {
            return descriptor;
        }
        List<Object> descendants = resolver.resolveArray(dict.get(Name.DESCENDANT_FONTS));
        if (descendants == null || descendants.isEmpty()) {
            return null;
        }
        Map<Name, Object> descendant = resolver.resolveDictionary(descendants.get(0));
        return (descendant != null)
            ? resolver.resolveDictionary(descendant.get(Name.FONT_DESCRIPTOR)) : null;
    }

    private static String nameValue(Object value) {
        return (value instanceof Name) ? ((Name) value).getValue() : null;
    }

    public int getObjectNumber() {
        return objectNumber;
    }

    /**
     * Returns the PostScript name of the font.
     *
     * @return the /BaseFont name without its solidus, or null
     */
    public String getBaseFont() {
        return baseFont;
    }

    /**
     * Returns the font subtype, e.g. "Type1", "TrueType" or "Type0".
     *
     * @return the subtype, or null
     */
    public String getSubtype() {
        return subtype;
    }

    /**
     * Returns the encoding name: the /Encoding name, or the /BaseEncoding of
     * an encoding dictionary.
     *
     * @return the encoding, or null
     */
    public String getEncoding() {
        return encoding;
    }

    public EncodingMode getEncodingMode() {
        return encodingMode;
    }

    public boolean isCID() {
        return encodingMode == EncodingMode.CID_IDENTITY;
    }

    /**
     * Returns the font's code to Unicode map.
     *
     * @return the map, or null if the font has none or it is empty
     */
    public ToUnicodeMap getToUnicode() {
        return toUnicode;
    }

    public boolean isEmbedded() {
        return embedded;
    }

    /**
     * Returns the embedded font program.
     *
     * @return a copy of the program bytes, or null if not embedded
     */
    public byte[] getFontProgram() {
        return (fontProgram != null) ? Arrays.copyOf(fontProgram, fontProgram.length) : null;
    }

    /**
     * Returns the name to report for text in this font.
     *
     * @param resourceName the name the page uses for the font
     * @return the base font name if known, otherwise the resource name
     */
    public String getDisplayName(Name resourceName) {
        if (baseFont != null && !baseFont.isEmpty()) {
            return baseFont;
        }
        return (resourceName != null) ? resourceName.getValue() : "";
    }

    @Override
    public String toString() {
        return "FontInfo[" + objectNumber + " " + baseFont + " " + subtype + " " + encodingMode + "]";
    }

}
