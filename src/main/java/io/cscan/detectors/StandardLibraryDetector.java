package io.cscan.detectors;

import io.cscan.model.ErrorType;
import io.cscan.model.VariableState;
import io.cscan.patterns.CPatterns;
import io.cscan.patterns.CPatterns.Call;
import io.cscan.patterns.FormatString;
import io.cscan.patterns.FormatString.Conversion;
import io.cscan.source.Clause;
import io.cscan.source.Clause.Kind;
import io.cscan.state.AnalysisContext;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Detects misuse of the C standard library:
 * calls to library functions whose header was never included, misspelled header names,
 * scanf destinations passed without '&', and printf formats that do not match their arguments.
 */
public class StandardLibraryDetector implements Detector {

    private static final Map<String, Integer> SCANF_FORMAT_INDEX = Map.of(
            "scanf", 0,
            "fscanf", 1,
            "sscanf", 1);

    private static final Map<String, Integer> PRINTF_FORMAT_INDEX = Map.of(
            "printf", 0,
            "fprintf", 1,
            "sprintf", 1,
            "snprintf", 2);

    @Override
    public String id() {
        return "standard-library";
    }

    @Override
    public ErrorType.Module module() {
        return ErrorType.Module.STANDARD_LIBRARY;
    }

    @Override
    public String description() {
        return "Detects missing or misspelled headers and scanf/printf argument mistakes";
    }

    @Override
    public void inspect(AnalysisContext ctx, Clause clause) {
        if (clause.kind() == Kind.DIRECTIVE) {
            checkHeaderSpelling(ctx, clause);
            return;
        }
        if (!clause.isExpression()) {
            return;
        }
        for (String expression : MemorySafetyDetector.expressionsOf(ctx, clause)) {
            for (Call call : CPatterns.calls(expression)) {
                checkHeader(ctx, call);
                if (SCANF_FORMAT_INDEX.containsKey(call.name())) {
                    checkScanf(ctx, clause, call, SCANF_FORMAT_INDEX.get(call.name()));
                } else if (PRINTF_FORMAT_INDEX.containsKey(call.name())) {
                    checkPrintf(ctx, call, PRINTF_FORMAT_INDEX.get(call.name()));
                }
            }
        }
    }

    private void checkHeaderSpelling(AnalysisContext ctx, Clause clause) {
        CPatterns.includedHeader(clause.text()).ifPresent(header ->
                ctx.config().correctHeaderFor(header).ifPresent(correct ->
                        ctx.report(header, ErrorType.HEADER_MISSPELLING,
                                String.format("Header '%s' does not exist; did you mean '%s'?", header, correct),
                                String.format("Change the directive to '#include <%s>'", correct))));
    }

    private void checkHeader(AnalysisContext ctx, Call call) {
        String function = call.name();
        if (ctx.userFunctions().contains(function)) {
            return;
        }
        Optional<String> header = ctx.config().requiredHeader(function);
        if (header.isEmpty() || ctx.includedHeaders().contains(header.get())) {
            return;
        }
        ctx.report(function, ErrorType.MISSING_HEADER,
                String.format("Function '%s' is used without including <%s>", function, header.get()),
                String.format("Add '#include <%s>' at the top of the file", header.get()));
    }

    private void checkScanf(AnalysisContext ctx, Clause clause, Call call, int formatIndex) {
        List<String> args = call.arguments();
        if (args.size() <= formatIndex) {
            return;
        }
        String format = FormatString.literalContents(args.get(formatIndex));
        int last = args.size() - 1;
        if (format != null) {
            last = Math.min(last, formatIndex + FormatString.argumentCount(FormatString.scanfConversions(format)));
        }
        for (int i = formatIndex + 1; i <= last; i++) {
            String arg = CPatterns.stripCastsAndParens(args.get(i));
            if (!CPatterns.isPlainIdentifier(arg)) {
                continue;
            }
            Optional<VariableState> binding = ctx.lookup(arg, clause);
            if (binding.isEmpty()) {
                continue;
            }
            VariableState state = binding.get();
            if (state.isPointer() || state.isArray() || state.isAggregate()) {
                continue;
            }
            ctx.report(arg, ErrorType.SCANF_MISSING_ADDRESS_OF,
                    String.format("%s() argument '%s' is passed without '&'; scanf needs the variable's address",
                            call.name(), arg),
                    String.format("Pass the address instead: %s(..., &%s)", call.name(), arg));
        }
    }

    private void checkPrintf(AnalysisContext ctx, Call call, int formatIndex) {
        List<String> args = call.arguments();
        if (args.size() <= formatIndex) {
            return;
        }
        String format = FormatString.literalContents(args.get(formatIndex));
        if (format == null) {
            return;
        }
        List<Conversion> conversions = FormatString.printfConversions(format);
        int expected = FormatString.argumentCount(conversions);
        int supplied = args.size() - formatIndex - 1;
        if (expected == supplied) {
            return;
        }
        String problem = expected > supplied ? "too few arguments" : "too many arguments";
        ctx.report(call.name(), ErrorType.PRINTF_ARGUMENT_MISMATCH,
                String.format("%s() format expects %d argument%s but %d %s given (%s)",
                        call.name(), expected, expected == 1 ? "" : "s", supplied,
                        supplied == 1 ? "was" : "were", problem),
                "Make every conversion specifier in the format match exactly one argument");
    }
}
