package ai.testscope.analyzer.typescript;

/** Node and field names of the tree-sitter JavaScript, TypeScript and TSX grammars. */
public class TypeScriptTreeSitterNodeTypes {

    // Blocks
    public static final String PROGRAM = "program";
    public static final String STATEMENT_BLOCK = "statement_block";
    public static final String COMMENT = "comment";
    public static final String ERROR = "ERROR";

    // Statements
    public static final String EXPRESSION_STATEMENT = "expression_statement";
    public static final String LEXICAL_DECLARATION = "lexical_declaration";
    public static final String VARIABLE_DECLARATION = "variable_declaration";
    public static final String VARIABLE_DECLARATOR = "variable_declarator";
    public static final String RETURN_STATEMENT = "return_statement";
    public static final String EXPORT_STATEMENT = "export_statement";
    public static final String CLASS_DECLARATION = "class_declaration";
    public static final String ABSTRACT_CLASS_DECLARATION = "abstract_class_declaration";
    public static final String FUNCTION_DECLARATION = "function_declaration";
    public static final String GENERATOR_FUNCTION_DECLARATION = "generator_function_declaration";
    public static final String CLASS_BODY = "class_body";
    public static final String METHOD_DEFINITION = "method_definition";

    // Expressions
    public static final String CALL_EXPRESSION = "call_expression";
    public static final String MEMBER_EXPRESSION = "member_expression";
    public static final String SUBSCRIPT_EXPRESSION = "subscript_expression";
    public static final String AWAIT_EXPRESSION = "await_expression";
    public static final String ASSIGNMENT_EXPRESSION = "assignment_expression";
    public static final String BINARY_EXPRESSION = "binary_expression";
    public static final String UNARY_EXPRESSION = "unary_expression";
    public static final String PARENTHESIZED_EXPRESSION = "parenthesized_expression";
    public static final String AS_EXPRESSION = "as_expression";
    public static final String SATISFIES_EXPRESSION = "satisfies_expression";
    public static final String NON_NULL_EXPRESSION = "non_null_expression";
    public static final String TYPE_ASSERTION = "type_assertion";
    public static final String ARROW_FUNCTION = "arrow_function";
    public static final String FUNCTION_EXPRESSION = "function_expression";
    public static final String FUNCTION = "function";
    public static final String GENERATOR_FUNCTION = "generator_function";
    public static final String ARGUMENTS = "arguments";
    public static final String SPREAD_ELEMENT = "spread_element";

    // Literals
    public static final String STRING = "string";
    public static final String STRING_FRAGMENT = "string_fragment";
    public static final String ESCAPE_SEQUENCE = "escape_sequence";
    public static final String TEMPLATE_STRING = "template_string";
    public static final String TEMPLATE_SUBSTITUTION = "template_substitution";
    public static final String NUMBER = "number";
    public static final String TRUE = "true";
    public static final String FALSE = "false";
    public static final String NULL = "null";
    public static final String UNDEFINED = "undefined";
    public static final String ARRAY = "array";
    public static final String OBJECT = "object";
    public static final String PAIR = "pair";
    public static final String SHORTHAND_PROPERTY_IDENTIFIER = "shorthand_property_identifier";
    public static final String COMPUTED_PROPERTY_NAME = "computed_property_name";

    // Names and patterns
    public static final String IDENTIFIER = "identifier";
    public static final String PROPERTY_IDENTIFIER = "property_identifier";
    public static final String TYPE_IDENTIFIER = "type_identifier";
    public static final String PRIVATE_PROPERTY_IDENTIFIER = "private_property_identifier";
    public static final String OBJECT_PATTERN = "object_pattern";
    public static final String ARRAY_PATTERN = "array_pattern";
    public static final String PAIR_PATTERN = "pair_pattern";
    public static final String SHORTHAND_PROPERTY_IDENTIFIER_PATTERN = "shorthand_property_identifier_pattern";
    public static final String OBJECT_ASSIGNMENT_PATTERN = "object_assignment_pattern";
    public static final String ASSIGNMENT_PATTERN = "assignment_pattern";
    public static final String REST_PATTERN = "rest_pattern";
    public static final String FORMAL_PARAMETERS = "formal_parameters";
    public static final String REQUIRED_PARAMETER = "required_parameter";
    public static final String OPTIONAL_PARAMETER = "optional_parameter";

    // Fields
    public static final String FIELD_FUNCTION = "function";
    public static final String FIELD_ARGUMENTS = "arguments";
    public static final String FIELD_OBJECT = "object";
    public static final String FIELD_PROPERTY = "property";
    public static final String FIELD_INDEX = "index";
    public static final String FIELD_NAME = "name";
    public static final String FIELD_VALUE = "value";
    public static final String FIELD_KEY = "key";
    public static final String FIELD_BODY = "body";
    public static final String FIELD_LEFT = "left";
    public static final String FIELD_RIGHT = "right";
    public static final String FIELD_OPERATOR = "operator";
    public static final String FIELD_ARGUMENT = "argument";
    public static final String FIELD_PARAMETERS = "parameters";
    public static final String FIELD_PARAMETER = "parameter";
    public static final String FIELD_PATTERN = "pattern";
    public static final String FIELD_DECLARATION = "declaration";

    private TypeScriptTreeSitterNodeTypes() {}
}
