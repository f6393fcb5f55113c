package im.arun.docsync.exception;

public class TopicNotFoundException extends DiscourseException {

    public TopicNotFoundException(String message) {
        super(message);
    }
}
