package RTK.Parsing;

import java.util.regex.PatternSyntaxException;

/**
 * Fatal error while parsing a regex or evaluating a postfix program. There is no partial result.
 */
public class RegexSyntaxException extends PatternSyntaxException {

    @java.io.Serial
    private static final long serialVersionUID = 3360515402935914321L;

    public RegexSyntaxException(String description, String regex, int index) {
        super(description, regex, index);
    }
}
