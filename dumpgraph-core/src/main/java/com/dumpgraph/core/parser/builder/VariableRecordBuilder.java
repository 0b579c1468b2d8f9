package com.dumpgraph.core.parser.builder;

import com.dumpgraph.core.model.Variable;
import com.dumpgraph.core.model.VariableAccess;
import com.dumpgraph.core.stream.ElementAttributes;

/**
 * Builds variables from {@code var} elements, wherever they appear. Where the record ends
 * up is decided by the assembler.
 */
public class VariableRecordBuilder implements RecordBuilder<Variable> {

    public static final String TAG = "var";

    @Override
    public String tag() {
        return TAG;
    }

    @Override
    public Variable build(ElementAttributes attributes) {
        return Variable.builder(attributes.require("id"))
            .nameTokenId(attributes.reference("nameToken"))
            .typeTokenIds(attributes.reference("typeStartToken"), attributes.reference("typeEndToken"))
            .scopeId(attributes.reference("scope"))
            .access(VariableAccess.fromDumpName(attributes.get("access")))
            .argument(attributes.flag("isArgument"))
            .array(attributes.flag("isArray"))
            .classType(attributes.flag("isClass"))
            .constant(attributes.flag("isConst"))
            .external(attributes.flag("isExtern"))
            .local(attributes.flag("isLocal"))
            .pointer(attributes.flag("isPointer"))
            .reference(attributes.flag("isReference"))
            .staticStorage(attributes.flag("isStatic"))
            .constness(attributes.intOrDefault("constness", 0))
            .build();
    }
}
