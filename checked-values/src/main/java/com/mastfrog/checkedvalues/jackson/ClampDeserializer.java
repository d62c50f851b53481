/*
 * The MIT License
 *
 * Copyright 2024 Mastfrog Technologies.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package com.mastfrog.checkedvalues.jackson;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;
import com.mastfrog.checkedvalues.Clamp;
import com.mastfrog.checkedvalues.ClampType;
import com.mastfrog.checkedvalues.MachineOverflowException;
import com.mastfrog.checkedvalues.OutOfBoundsException;
import java.io.IOException;

/**
 * Reads a raw integer and wraps it as a clamp of a fixed type; construction
 * failures become {@link InvalidFormatException}s.
 *
 * @author Tim Boudreau
 */
abstract class ClampDeserializer<C extends Clamp<C>> extends StdDeserializer<C> {

    final ClampType type;

    ClampDeserializer(Class<C> clampClass, ClampType type) {
        super(clampClass);
        this.type = type;
    }

    abstract C wrap(long raw);

    @Override
    public C deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        if (!p.hasToken(JsonToken.VALUE_NUMBER_INT)) {
            ctxt.reportInputMismatch(this, "Expected an integer for %s but got %s",
                    type, p.currentToken());
        }
        long raw = p.getLongValue();
        try {
            return wrap(raw);
        } catch (OutOfBoundsException | MachineOverflowException ex) {
            InvalidFormatException ife = InvalidFormatException.from(p,
                    ex.getMessage(), raw, handledType());
            ife.initCause(ex);
            throw ife;
        }
    }
}
