package com.forumapi.interfaces.http;

import com.forumapi.commons.exceptions.ClientException;
import com.forumapi.commons.exceptions.DomainErrorTranslator;
import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.HttpResponseException;
import io.javalin.http.HttpStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The only place where internal errors become HTTP responses.
 */
public final class ErrorHandler {

    private static final Logger LOG = LoggerFactory.getLogger(ErrorHandler.class);

    static final String INTERNAL_ERROR_MESSAGE = "an internal server error occurred";

    private ErrorHandler() {
    }

    public static void register(Javalin app) {
        app.exception(HttpResponseException.class, (e, ctx) ->
                ctx.status(e.getStatus()).json(ApiResponse.fail(e.getMessage())));
        app.exception(Exception.class, ErrorHandler::handle);
    }

    static void handle(Exception exception, Context ctx) {
        Throwable translated = DomainErrorTranslator.translate(exception);
        if (translated instanceof ClientException clientError) {
            ctx.status(clientError.getStatusCode()).json(ApiResponse.fail(clientError.getMessage()));
            return;
        }
        LOG.error("Unhandled error on {} {}", ctx.method(), ctx.path(), exception);
        ctx.status(HttpStatus.INTERNAL_SERVER_ERROR).json(ApiResponse.error(INTERNAL_ERROR_MESSAGE));
    }
}
