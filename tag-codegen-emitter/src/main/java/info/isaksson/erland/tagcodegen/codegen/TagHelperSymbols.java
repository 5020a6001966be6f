package info.isaksson.erland.tagcodegen.codegen;

/**
 * Names shared with the tag helper runtime library. Generated code must use them byte-for-byte.
 */
public final class TagHelperSymbols {
    private TagHelperSymbols() {}

    public static final String RUNNER_VARIABLE = "__tagHelperRunner";
    public static final String STRING_VALUE_BUFFER_VARIABLE = "__tagHelperStringValueBuffer";
    public static final String EXECUTION_CONTEXT_VARIABLE = "__tagHelperExecutionContext";
    public static final String SCOPE_MANAGER_VARIABLE = "__tagHelperScopeManager";
    public static final String BACKED_SCOPE_MANAGER_VARIABLE = "__backed" + SCOPE_MANAGER_VARIABLE;

    public static final String EXECUTION_CONTEXT_TYPE = "global::Microsoft.AspNetCore.Razor.Runtime.TagHelpers.TagHelperExecutionContext";
    public static final String RUNNER_TYPE = "global::Microsoft.AspNetCore.Razor.Runtime.TagHelpers.TagHelperRunner";
    public static final String SCOPE_MANAGER_TYPE = "global::Microsoft.AspNetCore.Razor.Runtime.TagHelpers.TagHelperScopeManager";
    public static final String TAG_MODE_TYPE = "global::Microsoft.AspNetCore.Razor.TagHelpers.TagMode";
    public static final String HTML_ATTRIBUTE_VALUE_STYLE_TYPE = "global::Microsoft.AspNetCore.Razor.TagHelpers.HtmlAttributeValueStyle";
    public static final String TEMPLATE_TYPE = "global::Microsoft.AspNetCore.Mvc.Razor.HelperResult";

    public static final String CREATE_TAG_HELPER_METHOD = "CreateTagHelper";
    public static final String EXECUTION_CONTEXT_ADD_METHOD = "Add";
    public static final String EXECUTION_CONTEXT_OUTPUT_PROPERTY = "Output";
    public static final String SET_OUTPUT_CONTENT_ASYNC_METHOD = "SetOutputContentAsync";
    public static final String ADD_HTML_ATTRIBUTE_METHOD = "AddHtmlAttribute";
    public static final String ADD_TAG_HELPER_ATTRIBUTE_METHOD = "AddTagHelperAttribute";
    public static final String RUN_ASYNC_METHOD = "RunAsync";
    public static final String SCOPE_MANAGER_BEGIN_METHOD = "Begin";
    public static final String SCOPE_MANAGER_END_METHOD = "End";
    public static final String START_WRITING_SCOPE_METHOD = "StartTagHelperWritingScope";
    public static final String END_WRITING_SCOPE_METHOD = "EndTagHelperWritingScope";
    public static final String IS_CONTENT_MODIFIED_PROPERTY = "IsContentModified";
    public static final String BEGIN_ADD_HTML_ATTRIBUTE_VALUES_METHOD = "BeginAddHtmlAttributeValues";
    public static final String END_ADD_HTML_ATTRIBUTE_VALUES_METHOD = "EndAddHtmlAttributeValues";
    public static final String ADD_HTML_ATTRIBUTE_VALUE_METHOD = "AddHtmlAttributeValue";
    public static final String BEGIN_WRITE_TAG_HELPER_ATTRIBUTE_METHOD = "BeginWriteTagHelperAttribute";
    public static final String END_WRITE_TAG_HELPER_ATTRIBUTE_METHOD = "EndWriteTagHelperAttribute";
    public static final String MARK_AS_HTML_ENCODED_METHOD = "Html.Raw";
    public static final String INVALID_INDEXER_ASSIGNMENT_METHOD = "InvalidTagHelperIndexerAssignment";
    public static final String WRITE_TAG_HELPER_OUTPUT_METHOD = "Write";

    public static final String WRITE_METHOD = "Write";
    public static final String WRITE_LITERAL_METHOD = "WriteLiteral";
    public static final String PUSH_WRITER_METHOD = "PushWriter";
    public static final String POP_WRITER_METHOD = "PopWriter";
    public static final String TEMPLATE_WRITER_VARIABLE = "__razor_template_writer";
    public static final String ATTRIBUTE_VALUE_WRITER_VARIABLE = "__razor_attribute_value_writer";

    /** Design-time sink for expressions. */
    public static final String DESIGN_TIME_VARIABLE = "__o";
}
