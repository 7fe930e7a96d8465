package com.coinscript.script;

import java.util.List;

import com.coinscript.script.codegen.CodeGenerator;
import com.coinscript.script.codegen.CompilationResult;
import com.coinscript.script.codegen.CompilerOptions;
import com.coinscript.script.parser.Declaration.CoinDecl;
import com.coinscript.script.parser.Lexer;
import com.coinscript.script.parser.Parser;
import com.coinscript.script.parser.Token;
import com.coinscript.tree.Program;
import com.coinscript.tree.SerializeOptions;

/**
 * CoinScript compiler front door.
 *
 * - tokenize / parse / compile CoinScript source
 * - parseTree for raw Tree IR source
 * - render programs using the configured formatting
 *
 * Every call is independent; an instance only carries options.
 */
public class CoinScript {

    private CompilerOptions options = new CompilerOptions();

    public void setMaxExpressionDepth(int depth) { options.setMaxExpressionDepth(depth); }

    public void setConservationCheck(boolean enabled) { options.setConservationCheck(enabled); }

    public void setPrettyPrint(boolean pretty) { options.setPrettyPrint(pretty); }

    public void setKeywordOpcodes(boolean keywords) { options.setKeywordOpcodes(keywords); }

    public void setLauncherId(String hex) { options.setLauncherId(hex); }

    public void setOptions(CompilerOptions options) {
        this.options = options == null ? new CompilerOptions() : options.copy();
    }

    public CompilerOptions getOptions() { return options.copy(); }

    public List<Token> tokenize(String source) {
        return new Lexer(source).tokenize();
    }

    public CoinDecl parse(String source) {
        return new Parser(tokenize(source)).setMaxDepth(options.getMaxExpressionDepth()).parseCoin();
    }

    public CompilationResult compile(String source) {
        return new CodeGenerator(options.copy()).generate(parse(source));
    }

    /** Raw Tree IR; parameters of a mod form are classified by the ALL-CAPS convention. */
    public Program parseTree(String name, String source) {
        return Program.fromSource(name, source);
    }

    public String render(Program program) {
        SerializeOptions opts = options.isPrettyPrint() ? SerializeOptions.pretty() : SerializeOptions.defaults();
        opts.setKeywords(options.isKeywordOpcodes());
        opts.setIncludes(program.getIncludes());
        return program.serialize(opts);
    }
}
