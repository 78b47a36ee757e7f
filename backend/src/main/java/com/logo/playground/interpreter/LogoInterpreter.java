package com.logo.playground.interpreter;

import com.logo.playground.exception.LogoException;
import com.logo.playground.model.ExecutionResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Random;

public class LogoInterpreter {

    private static final Logger logger = LoggerFactory.getLogger(LogoInterpreter.class);

    public static final int DEFAULT_MAX_CALL_DEPTH = 32;

    private final StatementExecutor executor;

    public LogoInterpreter() {
        this(DEFAULT_MAX_CALL_DEPTH, new Random());
    }

    public LogoInterpreter(int maxCallDepth, Random random) {
        this.executor = new StatementExecutor(new ExpressionEvaluator(random), maxCallDepth);
    }

    public ExecutionResult run(String script) throws LogoException {
        List<String> tokens = Tokenizer.tokenize(script);
        ExtractedProgram program = ProcedureExtractor.extract(tokens);

        logger.debug("Running {} tokens with {} procedures", program.tokens().size(), program.procedures().size());

        InterpreterContext context = new InterpreterContext(program.procedures());
        executor.execute(program.tokens(), context, 0);
        ExecutionResult result = context.toResult();

        logger.debug("Run produced {} segments for {} turtles", result.segments().size(), result.turtleOrder().size());
        return result;
    }
}
