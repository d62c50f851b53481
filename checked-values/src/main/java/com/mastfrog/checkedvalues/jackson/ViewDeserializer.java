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
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.mastfrog.checkedvalues.Validator;
import com.mastfrog.checkedvalues.View;
import java.io.IOException;
import java.util.function.UnaryOperator;

/**
 * Reads an item and wraps it in a view without validating it.
 *
 * @author Tim Boudreau
 */
final class ViewDeserializer<T> extends StdDeserializer<View<T>> {

    private final JavaType itemType;
    private final Validator<? super T> validator;
    private final UnaryOperator<T> copier;

    ViewDeserializer(JavaType itemType, Validator<? super T> validator, UnaryOperator<T> copier) {
        super(View.class);
        this.itemType = itemType;
        this.validator = validator;
        this.copier = copier;
    }

    @Override
    public View<T> deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        T item = ctxt.readValue(p, itemType);
        return View.withValidator(item, validator, copier);
    }
}
