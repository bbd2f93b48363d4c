package com.forumapi;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.forumapi.application.security.AuthenticationTokenManager;
import com.forumapi.application.security.PasswordHash;
import com.forumapi.application.usecase.AddCommentUseCase;
import com.forumapi.application.usecase.AddReplyUseCase;
import com.forumapi.application.usecase.AddThreadUseCase;
import com.forumapi.application.usecase.AddUserUseCase;
import com.forumapi.application.usecase.DeleteCommentUseCase;
import com.forumapi.application.usecase.DeleteReplyUseCase;
import com.forumapi.application.usecase.GetThreadDetailUseCase;
import com.forumapi.application.usecase.LikeUnlikeCommentUseCase;
import com.forumapi.application.usecase.LoginUserUseCase;
import com.forumapi.application.usecase.LogoutUserUseCase;
import com.forumapi.application.usecase.RefreshAuthenticationUseCase;
import com.forumapi.infrastructure.persistence.DbPool;
import com.forumapi.infrastructure.persistence.IdGenerator;
import com.forumapi.infrastructure.persistence.JdbcAuthenticationRepository;
import com.forumapi.infrastructure.persistence.JdbcCommentLikeRepository;
import com.forumapi.infrastructure.persistence.JdbcCommentRepository;
import com.forumapi.infrastructure.persistence.JdbcReplyRepository;
import com.forumapi.infrastructure.persistence.JdbcThreadRepository;
import com.forumapi.infrastructure.persistence.JdbcUserRepository;
import com.forumapi.infrastructure.persistence.SchemaMigrator;
import com.forumapi.infrastructure.persistence.SqlLoader;
import com.forumapi.infrastructure.security.BcryptPasswordHash;
import com.forumapi.infrastructure.security.JwtTokenManager;
import com.forumapi.interfaces.http.AuthHandler;
import com.forumapi.interfaces.http.CommentHandler;
import com.forumapi.interfaces.http.ErrorHandler;
import com.forumapi.interfaces.http.LikeHandler;
import com.forumapi.interfaces.http.ReplyHandler;
import com.forumapi.interfaces.http.ThreadHandler;
import com.forumapi.interfaces.http.UserHandler;
import io.javalin.Javalin;
import io.javalin.json.JavalinJackson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.time.Clock;

public class App {

    private static final Logger LOG = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        var config = Config.fromEnv();
        var dbPool = new DbPool(config);
        DataSource ds = dbPool.getDataSource();
        SchemaMigrator.migrate(ds);

        var app = create(ds, new JwtTokenManager(config), new BcryptPasswordHash());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            app.stop();
            dbPool.close();
        }));

        app.start(config.port());
        LOG.info("Forum API listening on port {}", config.port());
    }

    /**
     * Builds the full object graph on top of the given store and security services and
     * registers every route. The returned server is not started.
     */
    public static Javalin create(DataSource ds, AuthenticationTokenManager tokens, PasswordHash passwordHash) {
        var sql = new SqlLoader();
        var ids = IdGenerator.random();
        var clock = Clock.systemUTC();

        var userRepository = new JdbcUserRepository(ds, sql, ids, clock);
        var authenticationRepository = new JdbcAuthenticationRepository(ds, sql);
        var threadRepository = new JdbcThreadRepository(ds, sql, ids, clock);
        var commentRepository = new JdbcCommentRepository(ds, sql, ids, clock);
        var replyRepository = new JdbcReplyRepository(ds, sql, ids, clock);
        var likeRepository = new JdbcCommentLikeRepository(ds, sql, ids, clock);

        var userHandler = new UserHandler(new AddUserUseCase(userRepository, passwordHash));
        var authHandler = new AuthHandler(
                new LoginUserUseCase(userRepository, authenticationRepository, tokens, passwordHash),
                new RefreshAuthenticationUseCase(authenticationRepository, tokens),
                new LogoutUserUseCase(authenticationRepository));
        var threadHandler = new ThreadHandler(
                new AddThreadUseCase(threadRepository),
                new GetThreadDetailUseCase(threadRepository, commentRepository, replyRepository, likeRepository),
                tokens);
        var commentHandler = new CommentHandler(
                new AddCommentUseCase(threadRepository, commentRepository),
                new DeleteCommentUseCase(threadRepository, commentRepository),
                tokens);
        var replyHandler = new ReplyHandler(
                new AddReplyUseCase(threadRepository, commentRepository, replyRepository),
                new DeleteReplyUseCase(threadRepository, commentRepository, replyRepository),
                tokens);
        var likeHandler = new LikeHandler(
                new LikeUnlikeCommentUseCase(threadRepository, commentRepository, likeRepository),
                tokens);

        var mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        var app = Javalin.create(config -> {
            config.jsonMapper(new JavalinJackson(mapper, false));
            config.showJavalinBanner = false;
        });
        ErrorHandler.register(app);

        // User routes
        app.post("/users", userHandler::create);

        // Authentication routes
        app.post("/authentications", authHandler::login);
        app.put("/authentications", authHandler::refresh);
        app.delete("/authentications", authHandler::logout);

        // Thread routes
        app.post("/threads", threadHandler::create);
        app.get("/threads/{threadId}", threadHandler::get);

        // Comment routes
        app.post("/threads/{threadId}/comments", commentHandler::create);
        app.delete("/threads/{threadId}/comments/{commentId}", commentHandler::delete);

        // Reply routes
        app.post("/threads/{threadId}/comments/{commentId}/replies", replyHandler::create);
        app.delete("/threads/{threadId}/comments/{commentId}/replies/{replyId}", replyHandler::delete);

        // Like routes
        app.put("/threads/{threadId}/comments/{commentId}/likes", likeHandler::toggle);

        return app;
    }
}
