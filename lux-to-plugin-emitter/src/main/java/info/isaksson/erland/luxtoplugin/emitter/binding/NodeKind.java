package info.isaksson.erland.luxtoplugin.emitter.binding;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * AST node kinds the DSL can bind visitor methods to, with their names in both host
 * frameworks.
 *
 * <p>The Babel type name doubles as the DSL's own node name and as the Babel visitor key.
 * The SWC side carries the node struct, the wrapping enum variant (null when the node is
 * not wrapped), the qualified match pattern, and the {@code VisitMut} hook.</p>
 */
public enum NodeKind {

    // declarations
    FUNCTION_DECLARATION("FunctionDeclaration", "FnDecl", "Decl::Fn", "Decl::Fn(fn_decl)",
            "visit_function_declaration", "visit_mut_fn_decl",
            field("id", "ident"), seq("params", "function.params"), field("body", "function.body")),
    VARIABLE_DECLARATION("VariableDeclaration", "VarDecl", "Decl::Var", "Decl::Var(var_decl)",
            "visit_variable_declaration", "visit_mut_var_decl",
            field("kind", "kind"), seq("declarations", "decls")),
    VARIABLE_DECLARATOR("VariableDeclarator", "VarDeclarator", null, "VarDeclarator",
            "visit_variable_declarator", "visit_mut_var_declarator",
            field("id", "name"), field("init", "init")),
    CLASS_DECLARATION("ClassDeclaration", "ClassDecl", "Decl::Class", "Decl::Class(class_decl)",
            "visit_class_declaration", "visit_mut_class_decl"),

    // statements
    EXPRESSION_STATEMENT("ExpressionStatement", "ExprStmt", "Stmt::Expr", "Stmt::Expr(expr_stmt)",
            "visit_expression_statement", "visit_mut_expr_stmt",
            field("expression", "expr")),
    BLOCK_STATEMENT("BlockStatement", "BlockStmt", "Stmt::Block", "Stmt::Block(block_stmt)",
            "visit_block_statement", "visit_mut_block_stmt",
            seq("body", "stmts")),
    RETURN_STATEMENT("ReturnStatement", "ReturnStmt", "Stmt::Return", "Stmt::Return(return_stmt)",
            "visit_return_statement", "visit_mut_return_stmt",
            field("argument", "arg")),
    IF_STATEMENT("IfStatement", "IfStmt", "Stmt::If", "Stmt::If(if_stmt)",
            "visit_if_statement", "visit_mut_if_stmt",
            field("test", "test"), field("consequent", "cons"), field("alternate", "alt")),
    FOR_STATEMENT("ForStatement", "ForStmt", "Stmt::For", "Stmt::For(for_stmt)",
            "visit_for_statement", "visit_mut_for_stmt"),
    FOR_IN_STATEMENT("ForInStatement", "ForInStmt", "Stmt::ForIn", "Stmt::ForIn(for_in_stmt)",
            "visit_for_in_statement", "visit_mut_for_in_stmt"),
    FOR_OF_STATEMENT("ForOfStatement", "ForOfStmt", "Stmt::ForOf", "Stmt::ForOf(for_of_stmt)",
            "visit_for_of_statement", "visit_mut_for_of_stmt"),
    WHILE_STATEMENT("WhileStatement", "WhileStmt", "Stmt::While", "Stmt::While(while_stmt)",
            "visit_while_statement", "visit_mut_while_stmt"),
    SWITCH_STATEMENT("SwitchStatement", "SwitchStmt", "Stmt::Switch", "Stmt::Switch(switch_stmt)",
            "visit_switch_statement", "visit_mut_switch_stmt",
            seq("cases", "cases")),
    TRY_STATEMENT("TryStatement", "TryStmt", "Stmt::Try", "Stmt::Try(try_stmt)",
            "visit_try_statement", "visit_mut_try_stmt"),
    THROW_STATEMENT("ThrowStatement", "ThrowStmt", "Stmt::Throw", "Stmt::Throw(throw_stmt)",
            "visit_throw_statement", "visit_mut_throw_stmt",
            field("argument", "arg")),

    // expressions
    EXPRESSION("Expression", "Expr", null, "Expr",
            "visit_expression", "visit_mut_expr"),
    IDENTIFIER("Identifier", "Ident", "Expr::Ident", "Expr::Ident(ident)",
            "visit_identifier", "visit_mut_ident",
            field("name", "sym")),
    CALL_EXPRESSION("CallExpression", "CallExpr", "Expr::Call", "Expr::Call(call_expr)",
            "visit_call_expression", "visit_mut_call_expr",
            field("callee", "callee"), seq("arguments", "args")),
    MEMBER_EXPRESSION("MemberExpression", "MemberExpr", "Expr::Member", "Expr::Member(member_expr)",
            "visit_member_expression", "visit_mut_member_expr",
            field("object", "obj"), field("property", "prop"), field("computed", "computed")),
    BINARY_EXPRESSION("BinaryExpression", "BinExpr", "Expr::Bin", "Expr::Bin(bin_expr)",
            "visit_binary_expression", "visit_mut_bin_expr",
            field("left", "left"), field("right", "right"), field("operator", "op")),
    UNARY_EXPRESSION("UnaryExpression", "UnaryExpr", "Expr::Unary", "Expr::Unary(unary_expr)",
            "visit_unary_expression", "visit_mut_unary_expr",
            field("argument", "arg"), field("operator", "op")),
    ASSIGNMENT_EXPRESSION("AssignmentExpression", "AssignExpr", "Expr::Assign", "Expr::Assign(assign_expr)",
            "visit_assignment_expression", "visit_mut_assign_expr",
            field("left", "left"), field("right", "right"), field("operator", "op")),
    CONDITIONAL_EXPRESSION("ConditionalExpression", "CondExpr", "Expr::Cond", "Expr::Cond(cond_expr)",
            "visit_conditional_expression", "visit_mut_cond_expr",
            field("test", "test"), field("consequent", "cons"), field("alternate", "alt")),
    LOGICAL_EXPRESSION("LogicalExpression", "BinExpr", "Expr::Bin", "Expr::Bin(bin_expr)",
            "visit_logical_expression", "visit_mut_bin_expr",
            field("left", "left"), field("right", "right"), field("operator", "op")),
    ARRAY_EXPRESSION("ArrayExpression", "ArrayLit", "Expr::Array", "Expr::Array(array_lit)",
            "visit_array_expression", "visit_mut_array_lit",
            seq("elements", "elems")),
    OBJECT_EXPRESSION("ObjectExpression", "ObjectLit", "Expr::Object", "Expr::Object(object_lit)",
            "visit_object_expression", "visit_mut_object_lit",
            seq("properties", "props")),
    ARROW_FUNCTION_EXPRESSION("ArrowFunctionExpression", "ArrowExpr", "Expr::Arrow", "Expr::Arrow(arrow_expr)",
            "visit_arrow_function_expression", "visit_mut_arrow_expr",
            seq("params", "params"), field("body", "body"), field("async", "is_async")),
    FUNCTION_EXPRESSION("FunctionExpression", "FnExpr", "Expr::Fn", "Expr::Fn(fn_expr)",
            "visit_function_expression", "visit_mut_fn_expr"),
    NEW_EXPRESSION("NewExpression", "NewExpr", "Expr::New", "Expr::New(new_expr)",
            "visit_new_expression", "visit_mut_new_expr",
            field("callee", "callee"), seq("arguments", "args")),
    SEQUENCE_EXPRESSION("SequenceExpression", "SeqExpr", "Expr::Seq", "Expr::Seq(seq_expr)",
            "visit_sequence_expression", "visit_mut_seq_expr",
            seq("expressions", "exprs")),
    THIS_EXPRESSION("ThisExpression", "ThisExpr", "Expr::This", "Expr::This(this_expr)",
            "visit_this_expression", "visit_mut_this_expr"),
    AWAIT_EXPRESSION("AwaitExpression", "AwaitExpr", "Expr::Await", "Expr::Await(await_expr)",
            "visit_await_expression", "visit_mut_await_expr",
            field("argument", "arg")),
    YIELD_EXPRESSION("YieldExpression", "YieldExpr", "Expr::Yield", "Expr::Yield(yield_expr)",
            "visit_yield_expression", "visit_mut_yield_expr",
            field("argument", "arg")),

    // literals
    STRING_LITERAL("StringLiteral", "Str", "Lit::Str", "Lit::Str(str_lit)",
            "visit_string_literal", "visit_mut_str",
            field("value", "value")),
    NUMERIC_LITERAL("NumericLiteral", "Number", "Lit::Num", "Lit::Num(num_lit)",
            "visit_numeric_literal", "visit_mut_number",
            field("value", "value")),
    BOOLEAN_LITERAL("BooleanLiteral", "Bool", "Lit::Bool", "Lit::Bool(bool_lit)",
            "visit_boolean_literal", "visit_mut_bool",
            field("value", "value")),
    NULL_LITERAL("NullLiteral", "Null", "Lit::Null", "Lit::Null(null_lit)",
            "visit_null_literal", "visit_mut_null"),
    REGEXP_LITERAL("RegExpLiteral", "Regex", "Lit::Regex", "Lit::Regex(regex_lit)",
            "visit_regexp_literal", "visit_mut_regex"),
    TEMPLATE_LITERAL("TemplateLiteral", "Tpl", "Expr::Tpl", "Expr::Tpl(tpl)",
            "visit_template_literal", "visit_mut_tpl",
            seq("quasis", "quasis"), seq("expressions", "exprs")),
    TEMPLATE_ELEMENT("TemplateElement", "TplElement", null, "TplElement",
            "visit_template_element", "visit_mut_tpl_element",
            field("value", "raw"), field("tail", "tail")),

    // jsx
    JSX_ELEMENT("JSXElement", "JSXElement", "Expr::JSXElement", "Expr::JSXElement(jsx_element)",
            "visit_jsx_element", "visit_mut_jsx_element",
            field("openingElement", "opening"), seq("children", "children"), field("closingElement", "closing")),
    JSX_FRAGMENT("JSXFragment", "JSXFragment", "Expr::JSXFragment", "Expr::JSXFragment(jsx_fragment)",
            "visit_jsx_fragment", "visit_mut_jsx_fragment",
            seq("children", "children")),
    JSX_ATTRIBUTE("JSXAttribute", "JSXAttr", "JSXAttrOrSpread::JSXAttr", "JSXAttrOrSpread::JSXAttr(jsx_attr)",
            "visit_jsx_attribute", "visit_mut_jsx_attr",
            field("name", "name"), field("value", "value")),
    JSX_EXPRESSION_CONTAINER("JSXExpressionContainer", "JSXExprContainer", "JSXElementChild::JSXExprContainer",
            "JSXElementChild::JSXExprContainer(container)",
            "visit_jsx_expression_container", "visit_mut_jsx_expr_container",
            field("expression", "expr")),
    JSX_TEXT("JSXText", "JSXText", "JSXElementChild::JSXText", "JSXElementChild::JSXText(jsx_text)",
            "visit_jsx_text", "visit_mut_jsx_text",
            field("value", "value")),
    JSX_OPENING_ELEMENT("JSXOpeningElement", "JSXOpeningElement", null, "JSXOpeningElement",
            "visit_jsx_opening_element", "visit_mut_jsx_opening_element",
            field("name", "name"), seq("attributes", "attrs"), field("selfClosing", "self_closing")),

    // modules
    IMPORT_DECLARATION("ImportDeclaration", "ImportDecl", "ModuleDecl::Import", "ModuleDecl::Import(import_decl)",
            "visit_import_declaration", "visit_mut_import_decl",
            field("source", "src"), seq("specifiers", "specifiers")),
    EXPORT_NAMED_DECLARATION("ExportNamedDeclaration", "ExportDecl", "ModuleDecl::ExportDecl",
            "ModuleDecl::ExportDecl(export_decl)",
            "visit_export_named_declaration", "visit_mut_export_decl"),
    EXPORT_DEFAULT_DECLARATION("ExportDefaultDeclaration", "ExportDefaultDecl", "ModuleDecl::ExportDefaultDecl",
            "ModuleDecl::ExportDefaultDecl(export_default_decl)",
            "visit_export_default_declaration", "visit_mut_export_default_decl"),
    PROGRAM("Program", "Program", null, "Program",
            "visit_program", "visit_mut_program",
            seq("body", "body")),

    // typescript declarations
    TS_INTERFACE_DECLARATION("TSInterfaceDeclaration", "TsInterfaceDecl", "Decl::TsInterface",
            "Decl::TsInterface(ts_interface_decl)",
            "visit_ts_interface_declaration", "visit_mut_ts_interface_decl",
            field("id", "id"), field("body", "body"), field("typeParameters", "type_params")),
    TS_TYPE_ALIAS_DECLARATION("TSTypeAliasDeclaration", "TsTypeAliasDecl", "Decl::TsTypeAlias",
            "Decl::TsTypeAlias(ts_type_alias_decl)",
            "visit_ts_type_alias_declaration", "visit_mut_ts_type_alias_decl"),
    TS_ENUM_DECLARATION("TSEnumDeclaration", "TsEnumDecl", "Decl::TsEnum", "Decl::TsEnum(ts_enum_decl)",
            "visit_ts_enum_declaration", "visit_mut_ts_enum_decl"),
    TS_PROPERTY_SIGNATURE("TSPropertySignature", "TsPropertySignature", "TsTypeElement::TsPropertySignature",
            "TsTypeElement::TsPropertySignature(ts_prop_sig)",
            "visit_ts_property_signature", "visit_mut_ts_property_signature",
            field("key", "key"), field("typeAnnotation", "type_ann"), field("optional", "optional"),
            field("readonly", "readonly")),
    TS_METHOD_SIGNATURE("TSMethodSignature", "TsMethodSignature", "TsTypeElement::TsMethodSignature",
            "TsTypeElement::TsMethodSignature(ts_method_sig)",
            "visit_ts_method_signature", "visit_mut_ts_method_signature"),
    TS_INDEX_SIGNATURE("TSIndexSignature", "TsIndexSignature", "TsTypeElement::TsIndexSignature",
            "TsTypeElement::TsIndexSignature(ts_index_sig)",
            "visit_ts_index_signature", "visit_mut_ts_index_signature"),

    // typescript types
    TS_TYPE_REFERENCE("TSTypeReference", "TsTypeRef", "TsType::TsTypeRef", "TsType::TsTypeRef(ts_type_ref)",
            "visit_ts_type_reference", "visit_mut_ts_type_ref",
            field("typeName", "type_name"), field("typeParameters", "type_params")),
    TS_TYPE_ANNOTATION("TSTypeAnnotation", "TsTypeAnn", null, "TsTypeAnn",
            "visit_ts_type_annotation", "visit_mut_ts_type_ann",
            field("typeAnnotation", "type_ann")),
    TS_ARRAY_TYPE("TSArrayType", "TsArrayType", "TsType::TsArrayType", "TsType::TsArrayType(ts_array_type)",
            "visit_ts_array_type", "visit_mut_ts_array_type",
            field("elementType", "elem_type")),
    TS_UNION_TYPE("TSUnionType", "TsUnionType", "TsType::TsUnionOrIntersectionType",
            "TsType::TsUnionOrIntersectionType(TsUnionOrIntersectionType::TsUnionType(ts_union))",
            "visit_ts_union_type", "visit_mut_ts_union_type",
            seq("types", "types")),
    TS_STRING_KEYWORD("TSStringKeyword", "TsKeywordType", "TsType::TsKeywordType",
            "TsType::TsKeywordType(TsKeywordType { kind: TsKeywordTypeKind::TsStringKeyword, .. })",
            "visit_ts_string_keyword", "visit_mut_ts_keyword_type"),
    TS_NUMBER_KEYWORD("TSNumberKeyword", "TsKeywordType", "TsType::TsKeywordType",
            "TsType::TsKeywordType(TsKeywordType { kind: TsKeywordTypeKind::TsNumberKeyword, .. })",
            "visit_ts_number_keyword", "visit_mut_ts_keyword_type"),
    TS_BOOLEAN_KEYWORD("TSBooleanKeyword", "TsKeywordType", "TsType::TsKeywordType",
            "TsType::TsKeywordType(TsKeywordType { kind: TsKeywordTypeKind::TsBooleanKeyword, .. })",
            "visit_ts_boolean_keyword", "visit_mut_ts_keyword_type"),
    TS_ANY_KEYWORD("TSAnyKeyword", "TsKeywordType", "TsType::TsKeywordType",
            "TsType::TsKeywordType(TsKeywordType { kind: TsKeywordTypeKind::TsAnyKeyword, .. })",
            "visit_ts_any_keyword", "visit_mut_ts_keyword_type"),
    TS_VOID_KEYWORD("TSVoidKeyword", "TsKeywordType", "TsType::TsKeywordType",
            "TsType::TsKeywordType(TsKeywordType { kind: TsKeywordTypeKind::TsVoidKeyword, .. })",
            "visit_ts_void_keyword", "visit_mut_ts_keyword_type"),
    TS_TYPE_PARAMETER_INSTANTIATION("TSTypeParameterInstantiation", "TsTypeParamInstantiation", null,
            "TsTypeParamInstantiation",
            "visit_ts_type_parameter_instantiation", "visit_mut_ts_type_param_instantiation",
            seq("params", "params")),
    TS_TYPE_PARAMETER_DECLARATION("TSTypeParameterDeclaration", "TsTypeParamDecl", null, "TsTypeParamDecl",
            "visit_ts_type_parameter_declaration", "visit_mut_ts_type_param_decl",
            seq("params", "params")),

    // patterns
    PATTERN("Pattern", "Pat", null, "Pat",
            "visit_pattern", "visit_mut_pat"),
    ARRAY_PATTERN("ArrayPattern", "ArrayPat", "Pat::Array", "Pat::Array(array_pat)",
            "visit_array_pattern", "visit_mut_array_pat",
            seq("elements", "elems")),
    OBJECT_PATTERN("ObjectPattern", "ObjectPat", "Pat::Object", "Pat::Object(object_pat)",
            "visit_object_pattern", "visit_mut_object_pat",
            seq("properties", "props")),
    REST_ELEMENT("RestElement", "RestPat", "Pat::Rest", "Pat::Rest(rest_pat)",
            "visit_rest_element", "visit_mut_rest_pat",
            field("argument", "arg")),
    ASSIGNMENT_PATTERN("AssignmentPattern", "AssignPat", "Pat::Assign", "Pat::Assign(assign_pat)",
            "visit_assignment_pattern", "visit_mut_assign_pat",
            field("left", "left"), field("right", "right"));

    /** A node property under its Babel and SWC names. */
    public record Field(String babel, String swc, boolean sequence) {}

    public final String babelType;
    public final String swcType;
    /** Enum variant wrapping the SWC node ({@code Expr::Call}), or null. */
    public final String swcEnum;
    public final String swcPattern;
    public final String dslMethod;
    public final String swcVisitMutHook;
    public final List<Field> fields;

    NodeKind(String babelType, String swcType, String swcEnum, String swcPattern,
             String dslMethod, String swcVisitMutHook, Field... fields) {
        this.babelType = babelType;
        this.swcType = swcType;
        this.swcEnum = swcEnum;
        this.swcPattern = swcPattern;
        this.dslMethod = dslMethod;
        this.swcVisitMutHook = swcVisitMutHook;
        this.fields = List.of(fields);
    }

    private static Field field(String babel, String swc) {
        return new Field(babel, swc, false);
    }

    private static Field seq(String babel, String swc) {
        return new Field(babel, swc, true);
    }

    /** Babel visitor key, e.g. {@code CallExpression}. */
    public String babelVisitorKey() {
        return babelType;
    }

    /** Babel type checker on {@code t}, e.g. {@code isCallExpression}. */
    public String babelChecker() {
        return "is" + babelType;
    }

    /** Read-only {@code Visit} hook used by writers. */
    public String swcVisitHook() {
        return swcVisitMutHook.replace("visit_mut_", "visit_");
    }

    /** Binder name inside {@link #swcPattern}, e.g. {@code call_expr}; falls back to snake case of the SWC type. */
    public String swcBinder() {
        int open = swcPattern.lastIndexOf('(');
        int close = swcPattern.indexOf(')', open + 1);
        if (open >= 0 && close > open) {
            String inner = swcPattern.substring(open + 1, close);
            if (inner.matches("[a-z_][a-z0-9_]*")) return inner;
        }
        return snake(swcType);
    }

    /** The first sequence-valued field, used when the node is destructured as an array. */
    public Field sequenceField() {
        for (Field f : fields) {
            if (f.sequence()) return f;
        }
        return null;
    }

    /** SWC name of a property given under its DSL/Babel name, or null when unmapped. */
    public String swcFieldName(String babelName) {
        for (Field f : fields) {
            if (f.babel().equals(babelName)) return f.swc();
        }
        return null;
    }

    private static final Map<String, NodeKind> BY_METHOD;
    private static final Map<String, NodeKind> BY_NAME;

    static {
        Map<String, NodeKind> byMethod = new HashMap<>();
        Map<String, NodeKind> byName = new HashMap<>();
        for (NodeKind k : values()) {
            byMethod.put(k.dslMethod, k);
            byName.putIfAbsent(k.babelType, k);
        }
        BY_METHOD = Collections.unmodifiableMap(byMethod);
        BY_NAME = Collections.unmodifiableMap(byName);
    }

    /** Node kind bound to a DSL visitor method name, or null. */
    public static NodeKind forMethod(String dslMethod) {
        return dslMethod == null ? null : BY_METHOD.get(dslMethod);
    }

    /**
     * Node kind for a DSL node name; accepts qualified names such as
     * {@code Expression::CallExpression}. Returns null when unknown.
     */
    public static NodeKind forName(String name) {
        if (name == null) return null;
        int sep = name.lastIndexOf("::");
        String simple = sep >= 0 ? name.substring(sep + 2) : name;
        return BY_NAME.get(simple);
    }

    static String snake(String camel) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < camel.length(); i++) {
            char c = camel.charAt(i);
            if (Character.isUpperCase(c)) {
                if (i > 0 && !Character.isUpperCase(camel.charAt(i - 1))) sb.append('_');
                sb.append(Character.toLowerCase(c));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
