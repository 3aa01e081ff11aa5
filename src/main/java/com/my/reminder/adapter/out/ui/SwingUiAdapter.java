package com.my.reminder.adapter.out.ui;

import com.my.reminder.domain.model.AlertHandle;
import com.my.reminder.domain.model.Reminder;
import com.my.reminder.domain.port.out.ClockPort;
import com.my.reminder.domain.port.out.UiPort;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import javax.swing.BorderFactory;
import javax.swing.BoxLayout;
import javax.swing.DefaultListModel;
import javax.swing.JButton;
import javax.swing.JDialog;
import javax.swing.JFrame;
import javax.swing.JLabel;
import javax.swing.JList;
import javax.swing.JOptionPane;
import javax.swing.JPanel;
import javax.swing.JScrollPane;
import javax.swing.SwingUtilities;
import javax.swing.WindowConstants;
import java.awt.BorderLayout;
import java.awt.Component;
import java.awt.event.WindowAdapter;
import java.awt.event.WindowEvent;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 왜: 데스크톱 환경에서 알림을 항상 위에 뜨는 창으로 보여주되, 모든 Swing 호출을 EDT 에서만 수행하기 위함.
 */
@IfBuildProperty(name = "app.ui.mode", stringValue = "swing")
@ApplicationScoped
public class SwingUiAdapter implements UiPort {

    private static final Logger log = Logger.getLogger(SwingUiAdapter.class);
    private static final DateTimeFormatter LIST_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private final ClockPort clockPort;
    private final Map<String, JDialog> openAlerts = new ConcurrentHashMap<>();
    private final DefaultListModel<String> listModel = new DefaultListModel<>();
    private JFrame listFrame;

    public SwingUiAdapter(ClockPort clockPort) {
        this.clockPort = clockPort;
    }

    @Override
    public void scheduleOnUiThread(Runnable task) {
        SwingUtilities.invokeLater(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.errorf(e, "UI 작업 실패: %s", e.getMessage());
            }
        });
    }

    @Override
    public AlertHandle presentAlert(String title, String description) {
        requireEdt();
        AlertHandle handle = new AlertHandle(UUID.randomUUID().toString());
        JDialog dialog = new JDialog((JFrame) null, "Reminder Alert", false);
        dialog.setDefaultCloseOperation(WindowConstants.DISPOSE_ON_CLOSE);
        dialog.setSize(300, 200);
        dialog.setResizable(false);

        JPanel body = new JPanel();
        body.setLayout(new BoxLayout(body, BoxLayout.Y_AXIS));
        body.setBorder(BorderFactory.createEmptyBorder(10, 10, 10, 10));
        JLabel titleLabel = new JLabel("<html><b>Title: " + escape(title) + "</b></html>");
        JLabel descriptionLabel = new JLabel("<html><body style='width:220px'>Description: " + escape(description) + "</body></html>");
        JButton dismissButton = new JButton("Dismiss");
        dismissButton.addActionListener(e -> dismiss(handle));
        titleLabel.setAlignmentX(Component.CENTER_ALIGNMENT);
        descriptionLabel.setAlignmentX(Component.CENTER_ALIGNMENT);
        dismissButton.setAlignmentX(Component.CENTER_ALIGNMENT);
        body.add(titleLabel);
        body.add(descriptionLabel);
        body.add(dismissButton);
        dialog.getContentPane().add(body, BorderLayout.CENTER);

        dialog.addWindowListener(new WindowAdapter() {
            @Override
            public void windowClosed(WindowEvent e) {
                openAlerts.remove(handle.id());
            }
        });
        openAlerts.put(handle.id(), dialog);
        dialog.setAlwaysOnTop(true);
        dialog.setLocationRelativeTo(null);
        dialog.setVisible(true);
        return handle;
    }

    @Override
    public void dismiss(AlertHandle handle) {
        requireEdt();
        JDialog dialog = openAlerts.remove(handle.id());
        if (dialog != null) {
            dialog.dispose();
        }
    }

    @Override
    public void showReminders(List<Reminder> reminders) {
        requireEdt();
        listModel.clear();
        for (Reminder reminder : reminders) {
            String time = LIST_TIME.format(reminder.triggerAt().atZone(clockPort.zone()));
            String status = reminder.active() ? "Active" : "Expired";
            listModel.addElement(reminder.title() + " - " + time + " (" + status + ")");
        }
        if (listFrame == null) {
            listFrame = new JFrame("Reminder App");
            listFrame.setDefaultCloseOperation(WindowConstants.HIDE_ON_CLOSE);
            listFrame.setSize(360, 640);
            listFrame.getContentPane().add(new JScrollPane(new JList<>(listModel)), BorderLayout.CENTER);
            listFrame.setVisible(true);
        }
    }

    @Override
    public void showWarning(String message) {
        requireEdt();
        JOptionPane pane = new JOptionPane(message, JOptionPane.WARNING_MESSAGE);
        JDialog dialog = pane.createDialog("Warning");
        dialog.setModal(false);
        dialog.setVisible(true);
    }

    @PreDestroy
    void stop() {
        SwingUtilities.invokeLater(() -> {
            openAlerts.values().forEach(JDialog::dispose);
            openAlerts.clear();
            if (listFrame != null) {
                listFrame.dispose();
            }
        });
    }

    private void requireEdt() {
        if (!SwingUtilities.isEventDispatchThread()) {
            throw new IllegalStateException("Swing 컴포넌트는 EDT 에서만 변경할 수 있습니다.");
        }
    }

    private static String escape(String text) {
        return text.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
    }
}
