package info.isaksson.erland.luxtoplugin.emitter.babel;

/** Fixed JavaScript snippets the generated plugin pulls in on demand. */
final class BabelSupport {

    private BabelSupport() {}

    static final String HEADER = """
            // Generated by ReluxScript compiler
            // Do not edit manually
            """;

    static final String REQUIRE_FS = "const fs = require('fs');";
    static final String REQUIRE_PATH = "const path = require('path');";
    static final String REQUIRE_GENERATOR = "const generate = require('@babel/generator').default;";

    static final String JSON_HELPER = """
            const json = {
              stringify: (obj) => JSON.stringify(obj, null, 2),
              parse: (str) => JSON.parse(str),
              to_string: (obj) => JSON.stringify(obj),
              to_string_pretty: (obj) => JSON.stringify(obj, null, 2),
              from_str: (str) => JSON.parse(str),
            };
            """;

    static final String PARSER_HELPER = """
            const babelCore = require('@babel/core');
            const parser = {
              parse: (code) => babelCore.parseSync(code, { sourceType: 'module' }),
              parse_file: (file) => babelCore.parseSync(require('fs').readFileSync(file, 'utf8'), { filename: file }),
            };
            """;

    static final String MACRO_PRELUDE = """
            // Macro helpers
            function format(template, ...args) {
              let i = 0;
              return String(template).replace(/\\{\\{|\\}\\}|\\{[^}]*\\}/g, (m) => {
                if (m === '{{') return '{';
                if (m === '}}') return '}';
                const v = args[i++];
                return typeof v === 'object' && v !== null ? JSON.stringify(v) : String(v);
              });
            }
            function println(template, ...args) {
              console.log(format(template, ...args));
            }
            function eprintln(template, ...args) {
              console.error(format(template, ...args));
            }
            function vec(...items) {
              return items;
            }
            function panic(template, ...args) {
              throw new Error(template === undefined ? 'panic' : format(template, ...args));
            }
            function matches(value, predicate) {
              return typeof predicate === 'function' ? Boolean(predicate(value)) : value === predicate;
            }
            """;

    static final String BUILDER = """
            const builder = {
              _output: [],
              _indentLevel: 0,
              append(s) { this._output.push(s); },
              newline() { this._output.push('\\n'); },
              indent() { this._indentLevel++; },
              dedent() { this._indentLevel--; },
              toString() { return this._output.join(''); },
            };
            """;
}
