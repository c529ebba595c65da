package com.example.flowbridge.scan;

import com.example.flowbridge.agentspec.GenerationParameters;
import com.example.flowbridge.errors.FlowErrorCode;
import com.example.flowbridge.errors.UnsupportedPatternException;
import com.example.flowbridge.ir.IoField;
import com.example.flowbridge.ir.ToolDefinition;
import com.example.flowbridge.ir.ToolKind;
import com.example.flowbridge.script.Expr;
import com.example.flowbridge.script.Param;
import com.example.flowbridge.script.PythonParser;
import com.example.flowbridge.script.ScriptModule;
import com.example.flowbridge.script.Stmt;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * One pass over the top-level statements of a workflow script.
 * <p>
 * Collects {@code @function_tool} functions, {@code BaseModel} records, module-level {@code Agent(...)}
 * constructions and the body of {@code run_workflow}. Nothing is executed.
 * </p>
 */
@Slf4j
public class ModuleScanner {

    public static final String ENTRY_FUNCTION = "run_workflow";
    public static final String WORKFLOW_INPUT_CLASS = "WorkflowInput";

    private static final Set<String> AGENT_ARGUMENTS = Set.of(
            "name", "model", "instructions", "model_settings", "tools", "output_type");
    private static final Set<String> GENERATION_KEYS = Set.of("temperature", "top_p", "max_tokens");
    private static final Set<String> CONTEXT_PARAMETER_TYPES = Set.of("RunContextWrapper", "ToolContext");

    private final boolean strict;

    public ModuleScanner(boolean strict) {
        this.strict = strict;
    }

    public ScanFacts scan(String source) {
        return scan(PythonParser.parse(source));
    }

    public ScanFacts scan(ScriptModule module) {
        Map<String, ToolDefinition> tools = new LinkedHashMap<>();
        Map<String, Map<String, FieldSchema>> models = new LinkedHashMap<>();
        Stmt.FunctionDef entry = null;

        for (Stmt stmt : module.body()) {
            if (stmt instanceof Stmt.FunctionDef function) {
                if (isFunctionTool(function)) {
                    tools.put(function.name(), toolOf(function));
                }
                if (ENTRY_FUNCTION.equals(function.name())) {
                    entry = function;
                }
            } else if (stmt instanceof Stmt.ClassDef classDef && isBaseModel(classDef)) {
                models.put(classDef.name(), fieldsOf(classDef));
            }
        }

        Map<String, AgentDefinition> agents = new LinkedHashMap<>();
        for (Stmt stmt : module.body()) {
            String variable = null;
            Expr value = null;
            if (stmt instanceof Stmt.Assign assign && assign.targets().size() == 1
                    && assign.targets().get(0) instanceof Expr.Name name) {
                variable = name.id();
                value = assign.value();
            } else if (stmt instanceof Stmt.AnnAssign annAssign && annAssign.target() instanceof Expr.Name name) {
                variable = name.id();
                value = annAssign.value();
            }
            if (value instanceof Expr.Call call && ScriptExpressions.isNamed(call.func(), "Agent")) {
                agents.put(variable, agentOf(variable, call, models));
            }
        }

        if (entry == null) {
            throw new UnsupportedPatternException(FlowErrorCode.NO_RUN_WORKFLOW,
                    "Missing " + ENTRY_FUNCTION + " entrypoint");
        }

        List<Stmt> body = new ArrayList<>();
        String flowName = null;
        for (Stmt stmt : entry.body()) {
            Expr traceName = flowName == null ? traceName(stmt) : null;
            if (traceName != null) {
                flowName = ScriptExpressions.constString(traceName);
                if (flowName == null) {
                    flowName = ScanFacts.DEFAULT_FLOW_NAME;
                }
                body.addAll(((Stmt.With) stmt).body());
            } else {
                body.add(stmt);
            }
        }

        Map<String, FieldSchema> workflowInput = models.getOrDefault(WORKFLOW_INPUT_CLASS, Map.of());
        log.debug("Scanned script: agents={} tools={} models={} entryStatements={}",
                agents.size(), tools.size(), models.size(), body.size());
        return new ScanFacts(agents, tools, models, workflowInput, body, flowName);
    }

    private static boolean isFunctionTool(Stmt.FunctionDef function) {
        for (Expr decorator : function.decorators()) {
            Expr target = decorator instanceof Expr.Call call ? call.func() : decorator;
            if (ScriptExpressions.isNamed(target, "function_tool")) {
                return true;
            }
        }
        return false;
    }

    private ToolDefinition toolOf(Stmt.FunctionDef function) {
        List<IoField> inputs = new ArrayList<>();
        for (Param param : function.params()) {
            if (param.kind() == Param.Kind.VAR_POSITIONAL || param.kind() == Param.Kind.VAR_KEYWORD
                    || isContextParameter(param.annotation())) {
                continue;
            }
            String type = TypeAnnotations.scalarType(param.annotation());
            inputs.add(new IoField(param.name(), type != null ? type : "string"));
        }
        String resultType = TypeAnnotations.scalarType(function.returns());
        if (resultType == null) {
            if (strict) {
                throw new UnsupportedPatternException(FlowErrorCode.TOOL_RETURN_SCHEMA_MISSING,
                        "@function_tool must declare an encodable return annotation",
                        Map.of("tool", function.name()));
            }
            log.warn("Tool {} has no encodable return annotation, using result:string", function.name());
            resultType = "string";
        }
        return new ToolDefinition(function.name(), ToolKind.SERVER, inputs, List.of(new IoField("result", resultType)));
    }

    private static boolean isContextParameter(Expr annotation) {
        Expr base = annotation instanceof Expr.Subscript subscript ? subscript.value() : annotation;
        String dotted = ScriptExpressions.dottedName(base);
        if (dotted == null) {
            return false;
        }
        String simple = dotted.substring(dotted.lastIndexOf('.') + 1);
        return CONTEXT_PARAMETER_TYPES.contains(simple);
    }

    private static boolean isBaseModel(Stmt.ClassDef classDef) {
        return classDef.bases().stream().anyMatch(base -> ScriptExpressions.isNamed(base, "BaseModel"));
    }

    private static Map<String, FieldSchema> fieldsOf(Stmt.ClassDef classDef) {
        Map<String, FieldSchema> fields = new LinkedHashMap<>();
        for (Stmt stmt : classDef.body()) {
            if (stmt instanceof Stmt.AnnAssign field && field.target() instanceof Expr.Name name) {
                fields.put(name.id(), TypeAnnotations.fieldSchema(field.annotation()));
            }
        }
        return fields;
    }

    private AgentDefinition agentOf(String variable, Expr.Call call, Map<String, Map<String, FieldSchema>> models) {
        String displayName = null;
        String modelId = null;
        String instructions = null;
        GenerationParameters generation = GenerationParameters.NONE;
        List<String> toolNames = List.of();
        String outputType = null;

        if (!call.args().isEmpty()) {
            displayName = constantArgument(variable, "name", call.args().get(0));
            if (call.args().size() > 1) {
                reject(variable, "positional arguments", "Agent accepts only the name positionally");
            }
        }
        for (Expr.Keyword keyword : call.keywords()) {
            String key = keyword.name();
            if (key == null || !AGENT_ARGUMENTS.contains(key)) {
                reject(variable, key != null ? key : "**", "Agent argument has no schema counterpart");
                continue;
            }
            switch (key) {
                case "name" -> displayName = constantArgument(variable, key, keyword.value());
                case "model" -> modelId = constantArgument(variable, key, keyword.value());
                case "instructions" -> instructions = constantArgument(variable, key, keyword.value());
                case "model_settings" -> generation = generationOf(variable, keyword.value());
                case "tools" -> toolNames = toolNamesOf(variable, keyword.value());
                case "output_type" -> outputType = outputTypeOf(variable, keyword.value(), models);
                default -> throw new IllegalStateException("Unhandled agent argument " + key);
            }
        }
        return new AgentDefinition(variable, displayName, modelId, instructions, generation, toolNames, outputType);
    }

    private String constantArgument(String variable, String argument, Expr value) {
        String constant = ScriptExpressions.constString(value);
        if (constant == null) {
            reject(variable, argument, "Agent argument must be a constant string");
        }
        return constant;
    }

    private GenerationParameters generationOf(String variable, Expr value) {
        if (!(value instanceof Expr.Call call) || !ScriptExpressions.isNamed(call.func(), "ModelSettings")) {
            if (strict) {
                throw new UnsupportedPatternException(FlowErrorCode.UNSUPPORTED_MODEL_SETTINGS,
                        "model_settings must be a ModelSettings(...) call",
                        Map.of("agent", variable, "keys", List.of()));
            }
            log.warn("Agent {} model_settings is not a ModelSettings call, ignoring it", variable);
            return GenerationParameters.NONE;
        }
        Double temperature = null;
        Double topP = null;
        Integer maxTokens = null;
        Set<String> unsupported = new TreeSet<>();
        for (Expr.Keyword keyword : call.keywords()) {
            String key = keyword.name() != null ? keyword.name() : "**";
            if (!GENERATION_KEYS.contains(key)) {
                unsupported.add(key);
                continue;
            }
            Number number = ScriptExpressions.number(keyword.value());
            if (number == null) {
                log.warn("Agent {} model setting {} is not a numeric literal, ignoring it", variable, key);
                continue;
            }
            switch (key) {
                case "temperature" -> temperature = number.doubleValue();
                case "top_p" -> topP = number.doubleValue();
                default -> maxTokens = number.intValue();
            }
        }
        if (!unsupported.isEmpty()) {
            if (strict) {
                throw new UnsupportedPatternException(FlowErrorCode.UNSUPPORTED_MODEL_SETTINGS,
                        "Unsupported model_settings keys present",
                        Map.of("agent", variable, "keys", List.copyOf(unsupported)));
            }
            log.warn("Agent {} drops unsupported model settings keys={}", variable, unsupported);
        }
        return new GenerationParameters(temperature, topP, maxTokens);
    }

    private List<String> toolNamesOf(String variable, Expr value) {
        List<Expr> elements;
        if (value instanceof Expr.ListExpr list) {
            elements = list.elements();
        } else if (value instanceof Expr.TupleExpr tuple) {
            elements = tuple.elements();
        } else {
            reject(variable, "tools", "tools must be a list of tool references");
            return List.of();
        }
        List<String> names = new ArrayList<>();
        for (Expr element : elements) {
            Expr reference = element instanceof Expr.Call call ? call.func() : element;
            String name = ScriptExpressions.dottedName(reference);
            names.add(name != null ? name : "<expression>");
        }
        return names;
    }

    private String outputTypeOf(String variable, Expr value, Map<String, Map<String, FieldSchema>> models) {
        if (value instanceof Expr.NoneLiteral) {
            return null;
        }
        if (value instanceof Expr.Name name) {
            if ("str".equals(name.id())) {
                return null;
            }
            if (models.containsKey(name.id())) {
                return name.id();
            }
        }
        reject(variable, "output_type", "output_type must name a BaseModel class defined in the script");
        return null;
    }

    private void reject(String variable, String argument, String message) {
        if (strict) {
            throw new UnsupportedPatternException(FlowErrorCode.UNSUPPORTED_AGENT_ARGUMENT, message,
                    Map.of("agent", variable, "argument", argument));
        }
        log.warn("Agent {} argument {} ignored: {}", variable, argument, message);
    }

    /** The name argument of a {@code with trace(...)} statement; null for any other statement. */
    private static Expr traceName(Stmt stmt) {
        if (!(stmt instanceof Stmt.With with) || with.items().size() != 1) {
            return null;
        }
        if (with.items().get(0).context() instanceof Expr.Call call && ScriptExpressions.isNamed(call.func(), "trace")) {
            if (!call.args().isEmpty()) {
                return call.args().get(0);
            }
            Expr workflowName = call.keyword("workflow_name");
            return workflowName != null ? workflowName : new Expr.Str(ScanFacts.DEFAULT_FLOW_NAME);
        }
        return null;
    }
}
