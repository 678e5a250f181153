package com.cywriter;

import com.cywriter.ast.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Writes declaration-shaped parts of a code tree back to Cython source: extern blocks, C
 * types and declarators, struct/union/enum/cppclass definitions, typedefs, variable
 * declarations, class and {@code def} headers, and cimports, along with the simple expressions
 * those need.
 *
 * <p>Each instance writes one tree. All state (output lines, indentation) belongs to the
 * instance; writers are not thread-safe.</p>
 *
 * <pre>{@code
 * List<String> lines = new DeclarationWriter().write(tree).lines();
 * }</pre>
 */
public class DeclarationWriter implements TreeVisitor {
    private static final Logger log = LoggerFactory.getLogger(DeclarationWriter.class);

    private static final String INDENT = "    ";
    private static final String[] SIGN_PREFIXES = {"unsigned ", "", "signed "};

    protected final LinesResult result;
    private int numIndents = 0;
    private boolean used = false;

    public DeclarationWriter() {
        this(new LinesResult());
    }

    /**
     * @param result buffer to append to, e.g. one shared with a previous writer
     */
    public DeclarationWriter(LinesResult result) {
        this.result = result;
    }

    /**
     * Writes {@code tree} and returns the buffer holding the output.
     *
     * @throws CodeWriterException if the tree contains a node that cannot be written
     * @throws IllegalStateException if this writer was already used
     */
    public LinesResult write(Node tree) {
        if (used) {
            throw new IllegalStateException(getClass().getSimpleName() + " instances write a single tree");
        }
        used = true;
        log.debug("{} writing {}", getClass().getSimpleName(), tree.type());
        visit(tree);
        log.debug("{} wrote {} lines", getClass().getSimpleName(), result.lines().size());
        return result;
    }

    // ==================== Output primitives ====================

    protected void visit(Node node) {
        node.accept(this);
    }

    /**
     * Unit of indentation, repeated once per level.
     */
    protected String indentString() {
        return INDENT;
    }

    protected int indentLevel() {
        return numIndents;
    }

    protected void indent() {
        numIndents++;
    }

    protected void dedent() {
        numIndents--;
    }

    /**
     * Visits {@code node} one indentation level deeper.
     */
    protected void indented(Node node) {
        indent();
        visit(node);
        dedent();
    }

    protected void startLine(String s) {
        result.put(indentString().repeat(numIndents) + s);
    }

    protected void startLine() {
        startLine("");
    }

    protected void put(String s) {
        result.put(s);
    }

    protected void putLine(String s) {
        result.putLine(indentString().repeat(numIndents) + s);
    }

    protected void endLine(String s) {
        result.putLine(s);
    }

    protected void endLine() {
        endLine("");
    }

    protected void line(String s) {
        startLine(s);
        endLine();
    }

    /**
     * Visits {@code items} separated by {@code ", "}. With {@code outputRhs}, items carrying a
     * default value are followed by {@code " = "} and the default.
     */
    protected void commaSeparatedList(List<? extends Node> items, boolean outputRhs) {
        for (int i = 0; i < items.size(); i++) {
            if (i > 0) {
                put(", ");
            }
            Node item = items.get(i);
            visit(item);
            if (outputRhs && item instanceof HasDefaultValue withDefault && withDefault.defaultValue() != null) {
                put(" = ");
                visit(withDefault.defaultValue());
            }
        }
    }

    protected void commaSeparatedList(List<? extends Node> items) {
        commaSeparatedList(items, false);
    }

    /**
     * Writes {@code baseType} followed by a space, or nothing if the type is omitted.
     */
    protected void putTypePrefix(BaseTypeNode baseType) {
        if (baseType instanceof CSimpleBaseTypeNode simple && simple.name() == null) {
            return;
        }
        visit(baseType);
        put(" ");
    }

    /**
     * Starts a C function header: {@code cdef}/{@code cpdef}, visibility and {@code api}.
     */
    protected void startFunctionHeader(CFuncDefNode node) {
        startLine(node.overridable() ? "cpdef " : "cdef ");
        if (node.visibility() != null && !"private".equals(node.visibility())) {
            put(node.visibility());
            put(" ");
        }
        if (node.api()) {
            put("api ");
        }
    }

    private void putCName(String cname) {
        if (cname != null) {
            put(" \"" + cname + "\"");
        }
    }

    private void putDecorators(List<DecoratorNode> decorators) {
        for (DecoratorNode decorator : decorators) {
            visit(decorator);
        }
    }

    // ==================== Structure ====================

    @Override
    public void visitModule(ModuleNode node) {
        visit(node.body());
    }

    @Override
    public void visitStatList(StatListNode node) {
        if (node.stats().isEmpty()) {
            line("pass");
        } else {
            for (StatNode stat : node.stats()) {
                visit(stat);
            }
        }
    }

    @Override
    public void visitPassStat(PassStatNode node) {
        line("pass");
    }

    @Override
    public void visitDecorator(DecoratorNode node) {
        startLine("@");
        visit(node.decorator());
        endLine();
    }

    @Override
    public void visitAssertStat(AssertStatNode node) {
        startLine("assert ");
        visit(node.cond());
        if (node.value() != null) {
            put(", ");
            visit(node.value());
        }
        endLine();
    }

    @Override
    public void visitCDefExtern(CDefExternNode node) {
        String file = node.includeFile() == null ? "*" : "\"" + node.includeFile() + "\"";
        putLine("cdef extern from " + file + ":");
        indented(node.body());
    }

    // ==================== Declarators ====================

    @Override
    public void visitCNameDeclarator(CNameDeclaratorNode node) {
        if (node.name() != null) {
            put(node.name());
        }
        putCName(node.cname());
    }

    private static boolean isAnonymous(CNameDeclaratorNode node) {
        return (node.name() == null || node.name().isEmpty()) && node.cname() == null;
    }

    @Override
    public void visitCPtrDeclarator(CPtrDeclaratorNode node) {
        put("*");
        visit(node.base());
    }

    @Override
    public void visitCReferenceDeclarator(CReferenceDeclaratorNode node) {
        put("&");
        visit(node.base());
    }

    @Override
    public void visitCArrayDeclarator(CArrayDeclaratorNode node) {
        visitSuffixedBase(node.base());
        put("[");
        if (node.dimension() != null) {
            visit(node.dimension());
        }
        put("]");
    }

    @Override
    public void visitCFuncDeclarator(CFuncDeclaratorNode node) {
        if (node.exceptionValue() != null || node.exceptionCheck()) {
            throw new UnsupportedConstructException(node, "exception specification");
        }
        if (node.nogil() || node.withGil()) {
            throw new UnsupportedConstructException(node, "nogil / with gil marker");
        }
        visitSuffixedBase(node.base());
        put("(");
        commaSeparatedList(node.args());
        if (node.hasVarargs()) {
            if (!node.args().isEmpty()) {
                put(", ");
            }
            put("...");
        }
        put(")");
    }

    // Array and function suffixes bind tighter than * and &, so (*f)(int) needs the parentheses.
    private void visitSuffixedBase(DeclaratorNode base) {
        if (base instanceof CPtrDeclaratorNode || base instanceof CReferenceDeclaratorNode) {
            put("(");
            visit(base);
            put(")");
        } else {
            visit(base);
        }
    }

    // ==================== Base types ====================

    @Override
    public void visitCSimpleBaseType(CSimpleBaseTypeNode node) {
        for (String module : node.modulePath()) {
            put(module);
            put(".");
        }
        if (node.isBasicCType()) {
            if (node.signed() < 0 || node.signed() >= SIGN_PREFIXES.length) {
                throw new UnsupportedConstructException(node, "signedness " + node.signed());
            }
            put(SIGN_PREFIXES[node.signed()]);
            if (node.longness() < 0) {
                put("short ".repeat(-node.longness()));
            } else if (node.longness() > 0) {
                put("long ".repeat(node.longness()));
            }
        }
        if (node.name() != null) {
            put(node.name());
        }
    }

    @Override
    public void visitCComplexBaseType(CComplexBaseTypeNode node) {
        put("(");
        visit(node.baseType());
        visit(node.declarator());
        put(")");
    }

    @Override
    public void visitCNestedBaseType(CNestedBaseTypeNode node) {
        visit(node.baseType());
        put(".");
        put(node.name());
    }

    @Override
    public void visitTemplatedType(TemplatedTypeNode node) {
        visit(node.baseType());
        put("[");
        commaSeparatedList(node.positionalArgs());
        put("]");
    }

    // ==================== Declarations ====================

    @Override
    public void visitCVarDef(CVarDefNode node) {
        startLine("cdef ");
        visit(node.baseType());
        put(" ");
        commaSeparatedList(node.declarators(), true);
        endLine();
    }

    @Override
    public void visitCTypeDef(CTypeDefNode node) {
        startLine("ctypedef ");
        visit(node.baseType());
        put(" ");
        visit(node.declarator());
        endLine();
    }

    protected void visitContainer(String decl, String name, String cname, String extras,
                                  List<? extends Node> attributes) {
        startLine(decl);
        if (name != null && !name.isEmpty()) {
            put(" ");
            put(name);
            putCName(cname);
        }
        if (extras != null) {
            put(extras);
        }
        endLine(":");
        indent();
        if (attributes.isEmpty()) {
            putLine("pass");
        } else {
            for (Node attribute : attributes) {
                visit(attribute);
            }
        }
        dedent();
    }

    private static String containerPrefix(boolean typedefFlag, String visibility) {
        String decl = typedefFlag ? "ctypedef " : "cdef ";
        if ("public".equals(visibility)) {
            decl += "public ";
        }
        return decl;
    }

    @Override
    public void visitCStructOrUnionDef(CStructOrUnionDefNode node) {
        String decl = containerPrefix(node.typedefFlag(), node.visibility());
        if (node.packed()) {
            decl += "packed ";
        }
        decl += node.kind();
        visitContainer(decl, node.name(), node.cname(), null, node.attributes());
    }

    @Override
    public void visitCppClass(CppClassNode node) {
        String extras = "";
        if (!node.templates().isEmpty()) {
            extras = "[" + String.join(", ", node.templates()) + "]";
        }
        if (!node.baseClasses().isEmpty()) {
            extras += "(" + String.join(", ", node.baseClasses()) + ")";
        }
        visitContainer("cdef cppclass", node.name(), node.cname(), extras, node.attributes());
    }

    @Override
    public void visitCEnumDef(CEnumDefNode node) {
        String decl = containerPrefix(node.typedefFlag(), node.visibility()) + "enum";
        visitContainer(decl, node.name(), node.cname(), null, node.items());
    }

    @Override
    public void visitCEnumDefItem(CEnumDefItemNode node) {
        startLine(node.name());
        putCName(node.cname());
        if (node.value() != null) {
            put(" = ");
            visit(node.value());
        }
        endLine();
    }

    @Override
    public void visitCClassDef(CClassDefNode node) {
        if (node.moduleName() != null) {
            throw new UnsupportedConstructException(node, "extern class from module " + node.moduleName());
        }
        putDecorators(node.decorators());
        startLine("cdef class ");
        put(node.className());
        if (node.baseClassName() != null) {
            put("(");
            if (node.baseClassModule() != null) {
                put(node.baseClassModule());
                put(".");
            }
            put(node.baseClassName());
            put(")");
        }
        endLine(":");
        indented(node.body());
    }

    @Override
    public void visitPyClassDef(PyClassDefNode node) {
        startLine("class ");
        put(node.name());
        if (node.bases() != null && !node.bases().args().isEmpty()) {
            put("(");
            commaSeparatedList(node.bases().args());
            put(")");
        }
        endLine(":");
        indented(node.body());
    }

    @Override
    public void visitDef(DefNode node) {
        putDecorators(node.decorators());
        startLine("def " + node.name() + "(");
        commaSeparatedList(node.args());
        int argNum = node.args().size();
        if (node.starArg() != null) {
            if (argNum > 0) {
                put(", ");
            }
            put("*");
            put(node.starArg());
            argNum++;
        }
        if (node.starstarArg() != null) {
            if (argNum > 0) {
                put(", ");
            }
            put("**");
            put(node.starstarArg());
        }
        endLine("):");
        indented(node.body());
    }

    @Override
    public void visitCArgDecl(CArgDeclNode node) {
        if (node.baseType() instanceof CSimpleBaseTypeNode simple && simple.isSelfArg()) {
            put("self");
            return;
        }
        if (node.declarator() instanceof CNameDeclaratorNode name && isAnonymous(name)) {
            visit(node.baseType());
        } else {
            putTypePrefix(node.baseType());
            visit(node.declarator());
        }
        if (node.defaultValue() != null) {
            put(" = ");
            visit(node.defaultValue());
        }
    }

    @Override
    public void visitCImportStat(CImportStatNode node) {
        startLine("cimport ");
        put(node.moduleName());
        if (node.asName() != null) {
            put(" as ");
            put(node.asName());
        }
        endLine();
    }

    @Override
    public void visitFromCImportStat(FromCImportStatNode node) {
        startLine("from ");
        put(node.moduleName());
        put(" cimport ");
        putImportedNames(node, node.importedNames());
        endLine();
    }

    protected void putImportedNames(Node node, List<ImportedName> names) {
        boolean first = true;
        for (ImportedName name : names) {
            if (name.kind() != null) {
                throw new UnsupportedConstructException(node, name.kind() + " qualifier on imported name " + name.name());
            }
            if (first) {
                first = false;
            } else {
                put(", ");
            }
            put(name.name());
            if (name.asName() != null) {
                put(" as ");
                put(name.asName());
            }
        }
    }

    // ==================== Expressions ====================

    @Override
    public void visitName(NameNode node) {
        put(node.name());
    }

    @Override
    public void visitInt(IntNode node) {
        put(node.value() + node.unsigned() + node.longness());
    }

    @Override
    public void visitFloat(FloatNode node) {
        put(node.value());
    }

    @Override
    public void visitNone(NoneNode node) {
        put("None");
    }

    @Override
    public void visitNull(NullNode node) {
        put("NULL");
    }

    @Override
    public void visitBool(BoolNode node) {
        put(node.value() ? "True" : "False");
    }

    @Override
    public void visitString(StringNode node) {
        put(StringLiterals.quote(node.value()));
    }

    @Override
    public void visitUnicode(UnicodeNode node) {
        put(StringLiterals.quote("u", node.value()));
    }

    @Override
    public void visitBytes(BytesNode node) {
        put(StringLiterals.quoteBytes(node.value()));
    }

    @Override
    public void visitNot(NotNode node) {
        put("(not ");
        visit(node.operand());
        put(")");
    }

    @Override
    public void visitBinop(BinopNode node) {
        visit(node.operand1());
        put(" " + node.operator() + " ");
        visit(node.operand2());
    }

    @Override
    public void visitAttribute(AttributeNode node) {
        if (node.obj() instanceof AtomicExprNode || node.obj() instanceof AttributeNode) {
            visit(node.obj());
        } else {
            put("(");
            visit(node.obj());
            put(")");
        }
        put("." + node.attribute());
    }

    @Override
    public void visitTuple(TupleNode node) {
        put("(");
        commaSeparatedList(node.args());
        if (node.args().size() == 1) {
            put(",");
        }
        put(")");
    }

    @Override
    public void visitList(ListNode node) {
        put("[");
        commaSeparatedList(node.args());
        put("]");
    }
}
