package info.isaksson.erland.luxtoplugin.emitter.swc;

import info.isaksson.erland.luxtoplugin.emitter.detect.SupportMarker;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** Fixed Rust snippets: crate imports, the parser helper module and writer builder methods. */
final class SwcSupport {

    private SwcSupport() {}

    static final String HEADER = """
            // Generated by ReluxScript compiler
            // Do not edit manually
            """;

    static final List<String> BASE_USES = List.of(
            "use swc_common::{Span, DUMMY_SP, SyntaxContext};",
            "use swc_ecma_ast::*;",
            "use swc_ecma_visit::{Visit, VisitMut, VisitMutWith, VisitWith};");

    /** Marker-derived import lines for a plain module, without the visitor base imports. */
    static Set<String> moduleUses(Set<SupportMarker> markers) {
        Set<String> lines = uses(markers);
        lines.removeAll(BASE_USES);
        return lines;
    }

    /** Import lines for the detected markers, deduplicated, in a fixed order. */
    static Set<String> uses(Set<SupportMarker> markers) {
        Set<String> lines = new LinkedHashSet<>(BASE_USES);
        boolean map = markers.contains(SupportMarker.HASH_MAP);
        boolean set = markers.contains(SupportMarker.HASH_SET);
        if (map && set) lines.add("use std::collections::{HashMap, HashSet};");
        else if (map) lines.add("use std::collections::HashMap;");
        else if (set) lines.add("use std::collections::HashSet;");
        if (markers.contains(SupportMarker.JSON)) {
            lines.add("use serde::{Serialize, Deserialize};");
            lines.add("use serde_json;");
        }
        if (markers.contains(SupportMarker.FS) || markers.contains(SupportMarker.PATH)) {
            lines.add("use std::fs;");
            lines.add("use std::path::Path;");
        }
        if (markers.contains(SupportMarker.PARSER)) {
            lines.add("use std::sync::Arc;");
            lines.add("use swc_common::{SourceMap, FileName};");
            lines.add("use swc_ecma_parser::{Parser, Syntax, TsConfig, EsConfig, StringInput};");
        }
        if (markers.contains(SupportMarker.CODEGEN)) {
            lines.add("use std::sync::Arc;");
            if (!markers.contains(SupportMarker.PARSER)) lines.add("use swc_common::SourceMap;");
            lines.add("use swc_ecma_codegen::{Emitter, text_writer::JsWriter, Config as CodegenConfig, Node};");
        }
        if (markers.contains(SupportMarker.REGEX)) {
            lines.add("use regex::Regex as RegexPattern;");
        }
        return lines;
    }

    static final String CODEGEN_HELPER = """
            fn codegen_to_string<N: Node>(node: &N) -> String {
                let cm: Arc<SourceMap> = Default::default();
                let mut buf = vec![];
                {
                    let mut emitter = Emitter {
                        cfg: CodegenConfig::default(),
                        cm: cm.clone(),
                        comments: None,
                        wr: JsWriter::new(cm, "\\n", &mut buf, None),
                    };
                    node.emit_with(&mut emitter).expect("codegen failed");
                }
                String::from_utf8(buf).expect("codegen produced invalid UTF-8")
            }
            """;

    static final String PARSER_MODULE = """
            mod parser {
                use super::*;

                fn syntax_for(syntax_type: &str) -> Syntax {
                    match syntax_type {
                        "JSX" => Syntax::Es(EsConfig {
                            jsx: true,
                            ..Default::default()
                        }),
                        "JavaScript" => Syntax::Es(EsConfig::default()),
                        _ => Syntax::Typescript(TsConfig {
                            tsx: true,
                            decorators: false,
                            ..Default::default()
                        }),
                    }
                }

                fn parse_source(name: FileName, code: String, syntax: Syntax) -> Result<Program, String> {
                    let source_map = Arc::new(SourceMap::default());
                    let file = source_map.new_source_file(name, code);
                    let mut parser = Parser::new(syntax, StringInput::from(&*file), None);
                    parser.parse_program()
                        .map_err(|e| format!("Parse error: {:?}", e))
                }

                pub fn parse_file(path: &str) -> Result<Program, String> {
                    let code = std::fs::read_to_string(path)
                        .map_err(|e| format!("Failed to read file: {}", e))?;
                    parse_source(FileName::Real(path.into()), code, syntax_for("TypeScript"))
                }

                pub fn parse(code: &str) -> Result<Program, String> {
                    parse_source(FileName::Anon, code.to_string(), syntax_for("TypeScript"))
                }

                pub fn parse_with_syntax(code: &str, syntax_type: &str) -> Result<Program, String> {
                    parse_source(FileName::Anon, code.to_string(), syntax_for(syntax_type))
                }
            }
            """;

    static final String WRITER_METHODS = """
            fn append(&mut self, s: impl AsRef<str>) {
                if self.output.ends_with('\\n') {
                    for _ in 0..self.indent_level {
                        self.output.push_str("  ");
                    }
                }
                self.output.push_str(s.as_ref());
            }

            fn newline(&mut self) {
                self.output.push('\\n');
            }

            fn indent(&mut self) {
                self.indent_level += 1;
            }

            fn dedent(&mut self) {
                if self.indent_level > 0 {
                    self.indent_level -= 1;
                }
            }
            """;
}
