package fun.fengwk.wikitext.core.utils;

import org.springframework.ai.tool.execution.ToolCallResultConverter;

import java.lang.reflect.Type;

/**
 * Passes string tool results through without JSON quoting.
 *
 * @author fengwk
 */
public class StringToolCallResultConverter implements ToolCallResultConverter {

    @Override
    public String convert(Object result, Type returnType) {
        if (result == null) {
            return "";
        }
        if (result instanceof CharSequence cs) {
            return cs.toString();
        }
        throw new IllegalStateException("unsupported tool result type: " + result.getClass());
    }

}
