package me.christianrobert.py2lua.transformation.semantic.expression;

import me.christianrobert.py2lua.transformation.context.TransformationContext;
import me.christianrobert.py2lua.transformation.mapping.MemberNamingRule;

/**
 * Member access {@code base.member}.
 *
 * <p>This is where the API mapping enters translation. When the base is a bare
 * name imported from a mapped origin, the member name goes through that origin's
 * naming rule:
 * <pre>
 * from cc_lib import peripheral
 * peripheral.get_names      →  peripheral.getNames
 * device.get_type           →  device.get_type     (device not imported from cc_lib)
 * </pre>
 * Any other base (nested access, call result) keeps the member unchanged.
 */
public class AttributeAccess implements Expression {

    private final Expression base;
    private final String member;

    public AttributeAccess(Expression base, String member) {
        if (base == null) {
            throw new IllegalArgumentException("AttributeAccess base cannot be null");
        }
        if (member == null || member.trim().isEmpty()) {
            throw new IllegalArgumentException("AttributeAccess member cannot be null or empty");
        }
        this.base = base;
        this.member = member;
    }

    public Expression getBase() {
        return base;
    }

    public String getMember() {
        return member;
    }

    @Override
    public String toLua(TransformationContext context) {
        String baseLua = base.toLua(context);

        MemberNamingRule rule = MemberNamingRule.VERBATIM;
        if (base instanceof Identifier) {
            rule = context.memberNamingRuleFor(((Identifier) base).getName());
        }

        return baseLua + "." + rule.apply(member);
    }

    @Override
    public String toString() {
        return "AttributeAccess{base=" + base + ", member='" + member + "'}";
    }
}
