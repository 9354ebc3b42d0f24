package org.chakravyuha.ir.parse;

import org.chakravyuha.ir.Argument;
import org.chakravyuha.ir.BasicBlock;
import org.chakravyuha.ir.Constant;
import org.chakravyuha.ir.ConstantInt;
import org.chakravyuha.ir.ConstantString;
import org.chakravyuha.ir.Function;
import org.chakravyuha.ir.GlobalVariable;
import org.chakravyuha.ir.IrModule;
import org.chakravyuha.ir.UndefValue;
import org.chakravyuha.ir.Value;
import org.chakravyuha.ir.inst.AllocaInst;
import org.chakravyuha.ir.inst.BinaryInst;
import org.chakravyuha.ir.inst.BranchInst;
import org.chakravyuha.ir.inst.CallBranchInst;
import org.chakravyuha.ir.inst.CallInst;
import org.chakravyuha.ir.inst.CastInst;
import org.chakravyuha.ir.inst.GetElementPtrInst;
import org.chakravyuha.ir.inst.ICmpInst;
import org.chakravyuha.ir.inst.IndirectBranchInst;
import org.chakravyuha.ir.inst.Instruction;
import org.chakravyuha.ir.inst.InvokeInst;
import org.chakravyuha.ir.inst.LandingPadInst;
import org.chakravyuha.ir.inst.LoadInst;
import org.chakravyuha.ir.inst.Opcode;
import org.chakravyuha.ir.inst.PhiInst;
import org.chakravyuha.ir.inst.ReturnInst;
import org.chakravyuha.ir.inst.SelectInst;
import org.chakravyuha.ir.inst.StoreInst;
import org.chakravyuha.ir.inst.SwitchInst;
import org.chakravyuha.ir.inst.UnreachableInst;
import org.chakravyuha.ir.type.ArrayType;
import org.chakravyuha.ir.type.IntegerType;
import org.chakravyuha.ir.type.LabelType;
import org.chakravyuha.ir.type.PointerType;
import org.chakravyuha.ir.type.Type;
import org.chakravyuha.ir.type.VoidType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads the textual IR subset written by {@link org.chakravyuha.ir.IrPrinter}.
 * <p>
 * Parsing runs in two passes: the first registers globals and function
 * signatures so bodies can call functions defined further down, the second
 * parses each body. Inside a body, values and blocks may be referenced before
 * they are defined.
 */
public final class IrParser {

    private static final Logger logger = LoggerFactory.getLogger(IrParser.class);

    private static final Set<String> VALUE_KEYWORDS = new HashSet<>(Arrays.asList(
            "true", "false", "undef", "poison", "zeroinitializer"));

    private final List<String> lines;
    private final IrModule module;

    // per-function state
    private Function function;
    private Map<String, Value> values;
    private Map<String, ForwardReference> forwardValues;
    private Map<String, BasicBlock> blocks;
    private Map<String, Integer> blockFirstUse;
    private Set<String> definedBlocks;
    private BasicBlock currentBlock;

    private IrParser(String text, String moduleName) {
        this.lines = Arrays.asList(text.split("\r?\n", -1));
        this.module = new IrModule(moduleName);
    }

    public static IrModule parse(String text, String moduleName) throws IrParseException {
        return new IrParser(text, moduleName).parseModule();
    }

    public static IrModule parse(Path path) throws IOException, IrParseException {
        String text = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        return parse(text, path.getFileName().toString());
    }

    private IrModule parseModule() throws IrParseException {
        List<int[]> bodies = new ArrayList<>();
        List<Function> bodyFunctions = new ArrayList<>();
        int i = 0;
        while (i < lines.size()) {
            String line = lines.get(i);
            int lineNumber = i + 1;
            TokenStream ts = new TokenStream(IrLexer.tokenize(line, lineNumber), lineNumber, line);
            i++;
            if (ts.atEnd()) {
                continue;
            }
            if (ts.acceptWord("define")) {
                Function f = parseSignature(ts, true);
                int bodyStart = i;
                while (i < lines.size() && !lines.get(i).trim().equals("}")) {
                    i++;
                }
                if (i >= lines.size()) {
                    throw new IrParseException("Function @" + f.getName() + " has no closing '}'", lineNumber, line);
                }
                bodies.add(new int[]{bodyStart, i});
                bodyFunctions.add(f);
                i++;
            } else if (ts.acceptWord("declare")) {
                parseSignature(ts, false);
            } else if (ts.peekKind(Token.Kind.GLOBAL)) {
                parseGlobal(ts);
            } else if (ts.acceptWord("target")) {
                parseTarget(ts);
            } else if (ts.acceptWord("source_filename")) {
                ts.expectPunct('=');
                module.setSourceFileName(ts.expect(Token.Kind.STRING));
                ts.expectEnd();
            } else if (ts.peekWord("attributes") || ts.peek().getText().startsWith("!")) {
                logger.debug("Ignoring line {}: {}", lineNumber, line.trim());
            } else {
                throw ts.error("Unexpected top-level entity " + ts.peek());
            }
        }
        for (int b = 0; b < bodies.size(); b++) {
            parseBody(bodyFunctions.get(b), bodies.get(b)[0], bodies.get(b)[1]);
        }
        logger.debug("Parsed module {}: {} functions, {} globals",
                module.getName(), module.getFunctions().size(), module.getGlobals().size());
        return module;
    }

    private void parseTarget(TokenStream ts) throws IrParseException {
        if (ts.acceptWord("triple")) {
            ts.expectPunct('=');
            module.setTargetTriple(ts.expect(Token.Kind.STRING));
        } else {
            ts.expectWord("datalayout");
            ts.expectPunct('=');
            ts.expect(Token.Kind.STRING);
        }
        ts.expectEnd();
    }

    private void parseGlobal(TokenStream ts) throws IrParseException {
        String name = ts.expect(Token.Kind.GLOBAL);
        ts.expectPunct('=');
        boolean privateLinkage = false;
        boolean external = false;
        boolean constant;
        while (true) {
            String word = ts.expect(Token.Kind.WORD);
            if (word.equals("global") || word.equals("constant")) {
                constant = word.equals("constant");
                break;
            }
            if (word.equals("private") || word.equals("internal")) {
                privateLinkage = true;
            } else if (word.equals("external")) {
                external = true;
            }
        }
        Type valueType = parseType(ts);
        Constant initializer = null;
        if (!external) {
            initializer = parseInitializer(ts, valueType);
        }
        skipTrailingAttributes(ts);
        ts.expectEnd();
        try {
            module.addGlobal(new GlobalVariable(name, valueType, initializer, constant, privateLinkage));
        } catch (IllegalArgumentException e) {
            throw ts.error(e.getMessage(), e);
        }
    }

    private Constant parseInitializer(TokenStream ts, Type valueType) throws IrParseException {
        Token t = ts.next();
        if (t.getKind() == Token.Kind.CSTRING) {
            ConstantString str = new ConstantString(t.getData());
            if (!str.getType().equals(valueType)) {
                throw ts.error("String initializer has type " + str.getType() + " but global is " + valueType);
            }
            return str;
        }
        if (t.is(Token.Kind.WORD, "zeroinitializer")) {
            if (valueType instanceof ArrayType && ((ArrayType) valueType).getElementType() == IntegerType.I8) {
                return new ConstantString(new byte[((ArrayType) valueType).getLength()]);
            }
            if (valueType instanceof IntegerType) {
                return ConstantInt.get((IntegerType) valueType, 0);
            }
            throw ts.error("zeroinitializer is not supported for " + valueType);
        }
        if (t.is(Token.Kind.WORD, "undef")) {
            return UndefValue.get(valueType);
        }
        if (!(valueType instanceof IntegerType)) {
            throw ts.error("Unsupported initializer '" + t + "' for " + valueType);
        }
        return integerConstant(ts, t, (IntegerType) valueType);
    }

    private Function parseSignature(TokenStream ts, boolean definition) throws IrParseException {
        skipAttributeWords(ts);
        Type returnType = parseType(ts);
        String name = ts.expect(Token.Kind.GLOBAL);
        ts.expectPunct('(');
        List<Type> paramTypes = new ArrayList<>();
        List<String> paramNames = new ArrayList<>();
        if (!ts.acceptPunct(')')) {
            do {
                if (ts.peekWord("...")) {
                    throw ts.error("Variadic functions are not supported");
                }
                Type type = parseType(ts);
                if (type.isVoid() || type.isLabel()) {
                    throw ts.error("Invalid parameter type " + type);
                }
                skipAttributeWords(ts);
                String paramName = ts.peekKind(Token.Kind.LOCAL) ? ts.expect(Token.Kind.LOCAL) : null;
                if (definition && paramName == null) {
                    paramName = String.valueOf(paramTypes.size());
                }
                paramTypes.add(type);
                paramNames.add(paramName);
            } while (ts.acceptPunct(','));
            ts.expectPunct(')');
        }
        if (definition) {
            // trailing attributes such as #0 up to the opening brace
            while (!ts.atEnd() && !ts.peekPunct('{')) {
                ts.next();
            }
            ts.expectPunct('{');
        }
        ts.skipRest();
        Function f = new Function(name, returnType, paramTypes, paramNames);
        if (definition) {
            for (int i = 0; i < paramNames.size(); i++) {
                if (!f.getArgument(i).getName().equals(paramNames.get(i))) {
                    throw ts.error("Duplicate parameter name %" + paramNames.get(i));
                }
            }
        }
        try {
            module.addFunction(f);
        } catch (IllegalArgumentException e) {
            throw ts.error(e.getMessage(), e);
        }
        return f;
    }

    private void parseBody(Function f, int firstLine, int closingLine) throws IrParseException {
        function = f;
        values = new LinkedHashMap<>();
        forwardValues = new LinkedHashMap<>();
        blocks = new LinkedHashMap<>();
        blockFirstUse = new LinkedHashMap<>();
        definedBlocks = new HashSet<>();
        currentBlock = null;
        for (Argument arg : f.getArguments()) {
            values.put(arg.getName(), arg);
        }

        int i = firstLine;
        while (i < closingLine) {
            int lineNumber = i + 1;
            StringBuilder text = new StringBuilder(lines.get(i));
            List<Token> tokens = IrLexer.tokenize(text.toString(), lineNumber);
            i++;
            // a switch case list may span several lines
            while (bracketDepth(tokens) > 0 && i < closingLine) {
                text.append(' ').append(lines.get(i));
                tokens = IrLexer.tokenize(text.toString(), lineNumber);
                i++;
            }
            TokenStream ts = new TokenStream(tokens, lineNumber, text.toString());
            if (ts.atEnd()) {
                continue;
            }
            if (tokens.size() == 2 && tokens.get(1).isPunct(':')
                    && (tokens.get(0).getKind() == Token.Kind.WORD || tokens.get(0).getKind() == Token.Kind.INT)) {
                startBlock(ts, tokens.get(0).getText());
                continue;
            }
            parseInstructionLine(ts);
        }
        finishBody(closingLine + 1);
    }

    private static int bracketDepth(List<Token> tokens) {
        int depth = 0;
        for (Token t : tokens) {
            if (t.isPunct('[')) {
                depth++;
            } else if (t.isPunct(']')) {
                depth--;
            }
        }
        return depth;
    }

    private void startBlock(TokenStream ts, String name) throws IrParseException {
        if (currentBlock != null && currentBlock.getTerminator() == null) {
            throw ts.error("Block %" + currentBlock.getName() + " does not end in a terminator");
        }
        if (definedBlocks.contains(name)) {
            throw ts.error("Duplicate block label " + name);
        }
        if (function.isNameTaken(name)) {
            throw ts.error("Label " + name + " clashes with a value name");
        }
        function.uniqueName(name);
        BasicBlock block = blocks.computeIfAbsent(name, BasicBlock::new);
        function.appendBlock(block);
        definedBlocks.add(name);
        currentBlock = block;
    }

    private void parseInstructionLine(TokenStream ts) throws IrParseException {
        if (currentBlock == null) {
            // unlabeled entry block
            currentBlock = function.createBlock("entry");
            blocks.put(currentBlock.getName(), currentBlock);
            definedBlocks.add(currentBlock.getName());
        } else if (currentBlock.getTerminator() != null) {
            throw ts.error("Instruction after the terminator of block %" + currentBlock.getName());
        }
        String name = null;
        Token second = ts.peek(1);
        if (ts.peekKind(Token.Kind.LOCAL) && second != null && second.isPunct('=')) {
            name = ts.expect(Token.Kind.LOCAL);
            ts.expectPunct('=');
            if (values.containsKey(name) || function.isNameTaken(name)) {
                throw ts.error("Redefinition of %" + name);
            }
        }
        Instruction inst;
        try {
            inst = parseInstruction(ts, name);
        } catch (IllegalArgumentException e) {
            throw ts.error(e.getMessage(), e);
        }
        skipTrailingAttributes(ts);
        ts.expectEnd();
        if (name != null && !inst.producesValue()) {
            throw ts.error("Cannot assign a name to an instruction without a result");
        }
        if (name == null && inst.producesValue()) {
            // an unnamed result still needs a printable name
            inst.setName(function.uniqueName(null));
            values.put(inst.getName(), inst);
        }
        currentBlock.append(inst);
        if (name != null) {
            defineValue(ts, name, inst);
        }
    }

    private void defineValue(TokenStream ts, String name, Value value) throws IrParseException {
        function.uniqueName(name);
        values.put(name, value);
        ForwardReference pending = forwardValues.remove(name);
        if (pending != null) {
            if (!pending.getType().equals(value.getType())) {
                throw ts.error("%" + name + " is defined as " + value.getType()
                        + " but was used as " + pending.getType() + " on line " + pending.getFirstUseLine());
            }
            pending.replaceAllUsesWith(value);
        }
    }

    private void finishBody(int closingLineNumber) throws IrParseException {
        if (currentBlock == null) {
            throw new IrParseException("Function @" + function.getName() + " has an empty body",
                    closingLineNumber, "}");
        }
        if (currentBlock.getTerminator() == null) {
            throw new IrParseException("Block %" + currentBlock.getName() + " does not end in a terminator",
                    closingLineNumber, "}");
        }
        for (ForwardReference pending : forwardValues.values()) {
            throw new IrParseException("Use of undefined value %" + pending.getName(),
                    pending.getFirstUseLine(), lines.get(pending.getFirstUseLine() - 1));
        }
        for (Map.Entry<String, BasicBlock> entry : blocks.entrySet()) {
            if (!definedBlocks.contains(entry.getKey())) {
                int line = blockFirstUse.getOrDefault(entry.getKey(), closingLineNumber);
                throw new IrParseException("Use of undefined label %" + entry.getKey(), line, lines.get(line - 1));
            }
        }
    }

    private Instruction parseInstruction(TokenStream ts, String name) throws IrParseException {
        String op = ts.expect(Token.Kind.WORD);
        if (op.equals("tail") || op.equals("musttail") || op.equals("notail")) {
            op = ts.expect(Token.Kind.WORD);
        }
        Opcode opcode = Opcode.fromMnemonic(op);
        if (opcode == null) {
            throw ts.error("Unknown instruction '" + op + "'");
        }
        if (opcode.isBinary()) {
            while (ts.peekWord("nsw") || ts.peekWord("nuw") || ts.peekWord("exact") || ts.peekWord("disjoint")) {
                ts.next();
            }
            Type type = parseType(ts);
            Value lhs = parseValue(ts, type);
            ts.expectPunct(',');
            Value rhs = parseValue(ts, type);
            return new BinaryInst(opcode, lhs, rhs, name);
        }
        if (opcode.isCast()) {
            Value value = parseTypedValue(ts);
            ts.expectWord("to");
            return new CastInst(opcode, value, integerType(ts, parseType(ts)), name);
        }
        switch (opcode) {
            case ICMP: {
                String predicateName = ts.expect(Token.Kind.WORD);
                ICmpInst.Predicate predicate = ICmpInst.Predicate.fromMnemonic(predicateName);
                if (predicate == null) {
                    throw ts.error("Unknown icmp predicate '" + predicateName + "'");
                }
                Type type = parseType(ts);
                Value lhs = parseValue(ts, type);
                ts.expectPunct(',');
                return new ICmpInst(predicate, lhs, parseValue(ts, type), name);
            }
            case SELECT: {
                Value condition = parseTypedValue(ts, IntegerType.I1);
                ts.expectPunct(',');
                Value trueValue = parseTypedValue(ts);
                ts.expectPunct(',');
                return new SelectInst(condition, trueValue, parseTypedValue(ts), name);
            }
            case ALLOCA:
                return new AllocaInst(parseType(ts), name);
            case LOAD: {
                boolean isVolatile = ts.acceptWord("volatile");
                Type type = parseType(ts);
                ts.expectPunct(',');
                return new LoadInst(type, parseTypedValue(ts, PointerType.PTR), isVolatile, name);
            }
            case STORE: {
                boolean isVolatile = ts.acceptWord("volatile");
                Value value = parseTypedValue(ts);
                ts.expectPunct(',');
                return new StoreInst(value, parseTypedValue(ts, PointerType.PTR), isVolatile);
            }
            case GEP: {
                ts.acceptWord("inbounds");
                Type elementType = parseType(ts);
                ts.expectPunct(',');
                Value base = parseTypedValue(ts, PointerType.PTR);
                ts.expectPunct(',');
                Value index = parseTypedValue(ts);
                if (!index.getType().isInteger()) {
                    throw ts.error("getelementptr index must be an integer");
                }
                if (ts.peekPunct(',') && !isTrailingAttribute(ts.peek(1))) {
                    throw ts.error("Only single-index getelementptr is supported");
                }
                return new GetElementPtrInst(elementType, base, index, name);
            }
            case CALL: {
                Type returnType = parseType(ts);
                Function callee = parseCallee(ts, returnType);
                List<Value> args = parseArguments(ts, callee);
                // function attribute groups
                while (ts.peekKind(Token.Kind.WORD) && ts.peek().getText().startsWith("#")) {
                    ts.next();
                }
                return new CallInst(callee, args, name);
            }
            case PHI: {
                Type type = parseType(ts);
                PhiInst phi = new PhiInst(type, name);
                do {
                    ts.expectPunct('[');
                    Value value = parseValue(ts, type);
                    ts.expectPunct(',');
                    BasicBlock block = blockRef(ts, ts.expect(Token.Kind.LOCAL));
                    ts.expectPunct(']');
                    phi.addIncoming(value, block);
                } while (ts.acceptPunct(','));
                return phi;
            }
            case LANDINGPAD:
                // result type and clauses are not modelled
                ts.skipRest();
                return new LandingPadInst(name);
            case BR: {
                if (ts.acceptWord("label")) {
                    return new BranchInst(blockRef(ts, ts.expect(Token.Kind.LOCAL)));
                }
                Value condition = parseTypedValue(ts, IntegerType.I1);
                ts.expectPunct(',');
                BasicBlock thenBlock = parseLabel(ts);
                ts.expectPunct(',');
                return new BranchInst(condition, thenBlock, parseLabel(ts));
            }
            case SWITCH: {
                Value condition = parseTypedValue(ts);
                IntegerType type = integerType(ts, condition.getType());
                ts.expectPunct(',');
                SwitchInst inst = new SwitchInst(condition, parseLabel(ts));
                ts.expectPunct('[');
                while (!ts.acceptPunct(']')) {
                    Type caseType = parseType(ts);
                    if (!caseType.equals(type)) {
                        throw ts.error("Case value must be " + type + ", got " + caseType);
                    }
                    ConstantInt caseValue = integerConstant(ts, ts.next(), type);
                    ts.expectPunct(',');
                    inst.addCase(caseValue, parseLabel(ts));
                }
                return inst;
            }
            case RET: {
                if (ts.acceptWord("void")) {
                    if (!function.getReturnType().isVoid()) {
                        throw ts.error("ret void in function returning " + function.getReturnType());
                    }
                    return new ReturnInst();
                }
                return new ReturnInst(parseTypedValue(ts, function.getReturnType()));
            }
            case UNREACHABLE:
                return new UnreachableInst();
            case INVOKE: {
                Type returnType = parseType(ts);
                Function callee = parseCallee(ts, returnType);
                List<Value> args = parseArguments(ts, callee);
                ts.expectWord("to");
                BasicBlock normal = parseLabel(ts);
                ts.expectWord("unwind");
                return new InvokeInst(callee, args, normal, parseLabel(ts), name);
            }
            case INDIRECTBR: {
                Value address = parseTypedValue(ts, PointerType.PTR);
                ts.expectPunct(',');
                return new IndirectBranchInst(address, parseLabelList(ts));
            }
            case CALLBR: {
                Type returnType = parseType(ts);
                Function callee = parseCallee(ts, returnType);
                List<Value> args = parseArguments(ts, callee);
                ts.expectWord("to");
                BasicBlock defaultDest = parseLabel(ts);
                return new CallBranchInst(callee, args, defaultDest, parseLabelList(ts), name);
            }
            default:
                throw ts.error("Unknown instruction '" + op + "'");
        }
    }

    private Function parseCallee(TokenStream ts, Type returnType) throws IrParseException {
        String calleeName = ts.expect(Token.Kind.GLOBAL);
        Function callee = module.getFunction(calleeName);
        if (callee == null) {
            throw ts.error("Call to undeclared function @" + calleeName);
        }
        if (!callee.getReturnType().equals(returnType)) {
            throw ts.error("@" + calleeName + " returns " + callee.getReturnType() + ", not " + returnType);
        }
        return callee;
    }

    private List<Value> parseArguments(TokenStream ts, Function callee) throws IrParseException {
        ts.expectPunct('(');
        List<Value> args = new ArrayList<>();
        if (!ts.acceptPunct(')')) {
            do {
                Type type = parseType(ts);
                skipAttributeWords(ts);
                args.add(parseValue(ts, type));
            } while (ts.acceptPunct(','));
            ts.expectPunct(')');
        }
        if (args.size() != callee.getArguments().size()) {
            throw ts.error("@" + callee.getName() + " expects " + callee.getArguments().size()
                    + " arguments, got " + args.size());
        }
        for (int i = 0; i < args.size(); i++) {
            Type expected = callee.getArgument(i).getType();
            if (!args.get(i).getType().equals(expected)) {
                throw ts.error("Argument " + i + " of @" + callee.getName() + " must be " + expected);
            }
        }
        return args;
    }

    private List<BasicBlock> parseLabelList(TokenStream ts) throws IrParseException {
        List<BasicBlock> labels = new ArrayList<>();
        ts.expectPunct('[');
        if (!ts.acceptPunct(']')) {
            do {
                labels.add(parseLabel(ts));
            } while (ts.acceptPunct(','));
            ts.expectPunct(']');
        }
        return labels;
    }

    private BasicBlock parseLabel(TokenStream ts) throws IrParseException {
        ts.expectWord("label");
        return blockRef(ts, ts.expect(Token.Kind.LOCAL));
    }

    private BasicBlock blockRef(TokenStream ts, String name) {
        blockFirstUse.putIfAbsent(name, ts.getLineNumber());
        return blocks.computeIfAbsent(name, BasicBlock::new);
    }

    private Value parseTypedValue(TokenStream ts) throws IrParseException {
        Type type = parseType(ts);
        return parseValue(ts, type);
    }

    private Value parseTypedValue(TokenStream ts, Type expected) throws IrParseException {
        Type type = parseType(ts);
        if (!type.equals(expected)) {
            throw ts.error("Expected a value of type " + expected + ", got " + type);
        }
        return parseValue(ts, type);
    }

    private Value parseValue(TokenStream ts, Type type) throws IrParseException {
        Token t = ts.next();
        switch (t.getKind()) {
            case LOCAL:
                return localRef(ts, t.getText(), type);
            case GLOBAL: {
                Value global = module.getGlobal(t.getText());
                if (global == null) {
                    global = module.getFunction(t.getText());
                }
                if (global == null) {
                    throw ts.error("Use of undefined global @" + t.getText());
                }
                if (!type.isPointer()) {
                    throw ts.error("@" + t.getText() + " is a pointer, not " + type);
                }
                return global;
            }
            case INT:
                return integerConstant(ts, t, integerType(ts, type));
            case WORD:
                if (t.getText().equals("true") || t.getText().equals("false")) {
                    if (type != IntegerType.I1) {
                        throw ts.error(t.getText() + " must be i1, not " + type);
                    }
                    return t.getText().equals("true") ? ConstantInt.getTrue() : ConstantInt.getFalse();
                }
                if (t.getText().equals("undef") || t.getText().equals("poison")) {
                    return UndefValue.get(type);
                }
                if (t.getText().equals("zeroinitializer")) {
                    return ConstantInt.get(integerType(ts, type), 0);
                }
                throw ts.error("Unexpected '" + t + "' where a value was expected");
            default:
                throw ts.error("Unexpected '" + t + "' where a value was expected");
        }
    }

    private Value localRef(TokenStream ts, String name, Type type) throws IrParseException {
        Value value = values.get(name);
        if (value == null) {
            ForwardReference pending = forwardValues.get(name);
            if (pending == null) {
                pending = new ForwardReference(type, name, ts.getLineNumber());
                forwardValues.put(name, pending);
            }
            value = pending;
        }
        if (!value.getType().equals(type)) {
            throw ts.error("%" + name + " has type " + value.getType() + ", expected " + type);
        }
        return value;
    }

    private ConstantInt integerConstant(TokenStream ts, Token t, IntegerType type) throws IrParseException {
        if (t.getKind() == Token.Kind.INT) {
            return ConstantInt.get(type, IrLexer.parseLong(t.getText()));
        }
        if (type == IntegerType.I1 && t.is(Token.Kind.WORD, "true")) {
            return ConstantInt.getTrue();
        }
        if (type == IntegerType.I1 && t.is(Token.Kind.WORD, "false")) {
            return ConstantInt.getFalse();
        }
        throw ts.error("Expected an integer constant, got '" + t + "'");
    }

    private static IntegerType integerType(TokenStream ts, Type type) throws IrParseException {
        if (!(type instanceof IntegerType)) {
            throw ts.error("Expected an integer type, got " + type);
        }
        return (IntegerType) type;
    }

    private Type parseType(TokenStream ts) throws IrParseException {
        if (ts.acceptPunct('[')) {
            long length = IrLexer.parseLong(ts.expect(Token.Kind.INT));
            ts.expectWord("x");
            Type element = parseType(ts);
            ts.expectPunct(']');
            if (length < 0 || length > Integer.MAX_VALUE) {
                throw ts.error("Invalid array length " + length);
            }
            return new ArrayType(element, (int) length);
        }
        String word = ts.expect(Token.Kind.WORD);
        switch (word) {
            case "void":
                return VoidType.VOID;
            case "ptr":
                return PointerType.PTR;
            case "label":
                return LabelType.LABEL;
            default:
                if (word.matches("i\\d+")) {
                    try {
                        return IntegerType.of(Integer.parseInt(word.substring(1)));
                    } catch (IllegalArgumentException e) {
                        throw ts.error("Unsupported type " + word, e);
                    }
                }
                throw ts.error("Unknown type '" + word + "'");
        }
    }

    private static boolean isTypeWord(String word) {
        return word.equals("void") || word.equals("ptr") || word.equals("label") || word.matches("i\\d+");
    }

    /**
     * Skips linkage, visibility and parameter attributes such as
     * {@code dso_local} or {@code noundef}.
     */
    private static void skipAttributeWords(TokenStream ts) {
        while (ts.peekKind(Token.Kind.WORD)) {
            String word = ts.peek().getText();
            if (isTypeWord(word) || VALUE_KEYWORDS.contains(word) || word.equals("x")) {
                return;
            }
            ts.skipOne();
        }
    }

    private static boolean isTrailingAttribute(Token t) {
        return t != null && t.getKind() == Token.Kind.WORD
                && (t.getText().equals("align") || t.getText().startsWith("!"));
    }

    /**
     * Skips {@code , align N} and metadata attachments.
     */
    private static void skipTrailingAttributes(TokenStream ts) throws IrParseException {
        while (ts.peekPunct(',') && isTrailingAttribute(ts.peek(1))) {
            ts.expectPunct(',');
            if (ts.acceptWord("align")) {
                ts.expect(Token.Kind.INT);
            } else {
                while (ts.peekKind(Token.Kind.WORD) && ts.peek().getText().startsWith("!")) {
                    ts.skipOne();
                }
            }
        }
    }
}
