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

import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.type.TypeFactory;
import com.mastfrog.checkedvalues.ClampType;
import com.mastfrog.checkedvalues.HardClamp;
import com.mastfrog.checkedvalues.SoftClamp;
import com.mastfrog.checkedvalues.Validator;
import com.mastfrog.checkedvalues.View;
import java.util.function.UnaryOperator;

/**
 * Jackson module which reads and writes clamps and views as their bare raw
 * values. Limits, behaviors and validators are never written.
 * <p>
 * Serialization works out of the box. Since a clamp's type or a view's
 * validator cannot be recovered from a raw value, reading requires binding
 * the class being read to one clamp type (or item type and validator) before
 * the module is registered with a mapper:
 * </p>
 * <pre>
 * ObjectMapper mapper = new ObjectMapper().registerModule(
 *         new CheckedValuesModule().bindHard(PERCENT));
 * </pre>
 * Reading a hard clamp fails with an
 * {@link com.fasterxml.jackson.databind.exc.InvalidFormatException} if the
 * value is out of range; soft clamps and views are read whether valid or not.
 *
 * @author Tim Boudreau
 */
public final class CheckedValuesModule extends SimpleModule {

    public CheckedValuesModule() {
        super(CheckedValuesModule.class.getSimpleName());
        addSerializer(new ClampSerializer());
        addSerializer(new ViewSerializer());
    }

    public CheckedValuesModule bindHard(ClampType type) {
        addDeserializer(HardClamp.class, new HardClampDeserializer(type));
        return this;
    }

    public CheckedValuesModule bindSoft(ClampType type) {
        addDeserializer(SoftClamp.class, new SoftClampDeserializer(type));
        return this;
    }

    public <T> CheckedValuesModule bindView(Class<T> itemType, Validator<? super T> validator) {
        return bindView(itemType, validator, UnaryOperator.identity());
    }

    public <T> CheckedValuesModule bindView(Class<T> itemType, Validator<? super T> validator,
            UnaryOperator<T> copier) {
        @SuppressWarnings({"unchecked", "rawtypes"})
        Class<View<T>> viewType = (Class) View.class;
        addDeserializer(viewType, new ViewDeserializer<T>(
                TypeFactory.defaultInstance().constructType(itemType), validator, copier));
        return this;
    }
}
